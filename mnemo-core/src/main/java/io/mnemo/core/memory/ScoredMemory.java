package io.mnemo.core.memory;

public record ScoredMemory(Memory memory, double relevanceScore) {
}
