package io.mnemo.core.memory;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.atom.AtomType;
import io.mnemo.core.atom.MemoryAtom;
import io.mnemo.core.atom.Provenance;
import io.mnemo.core.atom.ProvenanceSource;
import io.mnemo.core.atom.Sensitivity;
import io.mnemo.core.text.TextSimilarity;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class MemoryMapperTest {
    private static final Instant CREATED = Instant.parse("2026-03-01T09:00:00.123Z");
    private static final Instant UPDATED = Instant.parse("2026-03-02T09:00:00.456Z");

    @Test
    void shouldMapMemoryOntoAtomAndBack() {
        Memory memory = new Memory(
            "m-1", "Tabs", "Indent with four spaces.", MemoryGroups.PREFERENCES, List.of("style"), MemorySource.MANUAL,
            0.8, CREATED, UPDATED, 2, UPDATED, List.of("s1"), List.of("m-0")
        );

        MemoryAtom atom = MemoryMapper.toAtom(memory, "project_x", null);

        assertThat(atom.atomType()).isEqualTo(AtomType.PREFERENCE);
        assertThat(atom.summary()).isEqualTo("Tabs");
        assertThat(atom.keywords()).containsExactly("style");
        assertThat(atom.provenance().source()).isEqualTo(ProvenanceSource.USER);
        assertThat(atom.provenance().createdBy()).isEqualTo(MemoryMapper.CREATED_BY);
        assertThat(atom.updatedAt()).isEqualTo(UPDATED.toEpochMilli());
        assertThat(MemoryMapper.toMemory(atom)).isEqualTo(memory);
    }

    @Test
    void shouldCarryStorageOnlyFieldsOfExistingAtom() {
        Memory memory = new Memory(
            "m-1", "Title", "Content", "research", List.of(), MemorySource.AUTO,
            0.5, CREATED, UPDATED, 0, null, null, null
        );
        MemoryAtom existing = new MemoryAtom(
            "m-1", "project_x", "session-9", "run-1", AtomType.SEMANTIC, "old", "old", List.of(),
            new Provenance(ProvenanceSource.TOOL, null, List.of("consolidated:merged"), "memory_consolidator_v1"),
            0.5, Sensitivity.RESTRICTED, true, CREATED.toEpochMilli(), CREATED.toEpochMilli(), null
        );

        MemoryAtom atom = MemoryMapper.toAtom(memory, "project_x", existing);

        assertThat(atom.pinned()).isTrue();
        assertThat(atom.sensitivity()).isEqualTo(Sensitivity.RESTRICTED);
        assertThat(atom.sessionId()).isEqualTo("session-9");
        assertThat(atom.atomType()).isEqualTo(AtomType.SEMANTIC);
        assertThat(atom.provenance().tags()).containsExactly("consolidated:merged");
        assertThat(MemoryMapper.toMemory(atom).group()).isEqualTo("research");
    }

    @Test
    void shouldDeriveViewFromAtomWithoutMetadata() {
        String longContent = "Remember that the staging database is refreshed from production every Sunday night.";
        MemoryAtom foreign = new MemoryAtom(
            "a-1", "project_x", null, null, AtomType.INSTRUCTIONS, longContent, null, List.of(),
            new Provenance(ProvenanceSource.ASSISTANT, "https://example.com", List.of(), null),
            0.6, null, false, 1_000L, 2_000L, null
        );

        Memory memory = MemoryMapper.toMemory(foreign);

        assertThat(memory.group()).isEqualTo(MemoryGroups.INSTRUCTIONS);
        assertThat(memory.source()).isEqualTo(MemorySource.AUTO);
        assertThat(memory.title()).endsWith("...").hasSizeLessThanOrEqualTo(63);
        assertThat(memory.createdAt()).isEqualTo(Instant.ofEpochMilli(1_000L));
        assertThat(memory.lastAccessedAt()).isEqualTo(Instant.ofEpochMilli(2_000L));
        assertThat(MemoryMapper.contentHashOf(foreign)).isEqualTo(TextSimilarity.contentHash(longContent));
    }

    @Test
    void shouldMapGroupsToAtomTypes() {
        assertThat(MemoryGroups.atomTypeFor(MemoryGroups.LEARNINGS)).isEqualTo(AtomType.SEMANTIC);
        assertThat(MemoryGroups.atomTypeFor("custom")).isEqualTo(AtomType.SEMANTIC);
        assertThat(MemoryGroups.forAtomType(AtomType.PROCEDURAL)).isEqualTo(MemoryGroups.LEARNINGS);
        assertThat(MemoryGroups.forAtomType(AtomType.CONTEXT)).isEqualTo(MemoryGroups.CONTEXT);
    }
}
