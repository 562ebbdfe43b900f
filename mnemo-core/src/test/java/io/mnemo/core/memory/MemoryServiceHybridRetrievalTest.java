package io.mnemo.core.memory;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.atom.MemoryAtom;
import io.mnemo.core.retrieval.MemoryQueryResult;
import io.mnemo.core.retrieval.QueryOptions;
import io.mnemo.core.store.MemoryStores;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MemoryServiceHybridRetrievalTest {

    private static final List<String> RELEVANT = List.of(
        "Before merging pull requests, run lint and typecheck commands.",
        "Merge gate requires lint plus typecheck to pass cleanly.",
        "Project policy: execute lint and typecheck before any merge.",
        "Run lint, then run typecheck, then merge when both are green.",
        "CI expects lint and typecheck checks before merge approval.",
        "Always perform lint and typecheck validation prior to merging.",
        "Pre-merge checklist includes lint and typecheck execution.",
        "Do not merge until lint and typecheck both complete successfully.",
        "Lint and typecheck are mandatory pre-merge validation steps.",
        "Merge readiness depends on lint and typecheck results."
    );

    private static final List<String> NOISE = List.of(
        "Use onboarding wizard defaults for first run setup.",
        "Browser operator should capture blocker screenshots for review.",
        "Keep release gate status visible in dashboard header.",
        "Store connector secrets in keychain-backed secure storage.",
        "Workflow retries should include deterministic compensation hooks.",
        "Prefer concise response tone in general conversations.",
        "Use branch merge graph panel for branch conflict navigation.",
        "Schedule periodic benchmark runs for trend monitoring.",
        "Use memory inspector to pin important long-term entries.",
        "Enable research mode with multi-source evidence synthesis."
    );

    @TempDir
    Path tempDir;

    @Test
    void shouldKeepPrecisionAtEightOnSeededEvaluationSet() throws Exception {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        MemoryService service = new MemoryService(tempDir, MemoryStores.inMemory(), clock);
        service.initialize();

        for (int i = 0; i < RELEVANT.size(); i++) {
            String title = "relevant-" + (i + 1);
            service.create(new CreateMemoryInput(
                title, RELEVANT.get(i), MemoryGroups.LEARNINGS, List.of("lint", "typecheck", "merge", title),
                MemorySource.AUTO, 0.95, null
            ));
        }
        for (int i = 0; i < NOISE.size(); i++) {
            service.create(new CreateMemoryInput(
                "noise-" + (i + 1), NOISE.get(i), MemoryGroups.CONTEXT, List.of("noise", "topic-" + (i + 1)),
                MemorySource.AUTO, 0.55, null
            ));
        }

        MemoryQueryResult result = service.deepQuery(
            "session-hybrid-test",
            "Before merge we must run lint and typecheck checks.",
            QueryOptions.builder()
                .limit(8)
                .lexicalWeight(0.35)
                .denseWeight(0.4)
                .graphWeight(0.15)
                .rerankWeight(0.1)
                .build()
        );

        long relevantHits = result.atoms().stream()
            .map(MemoryAtom::content)
            .map(content -> content.toLowerCase(Locale.ROOT))
            .filter(content -> content.contains("lint") && content.contains("typecheck"))
            .filter(content -> content.contains("merge") || content.contains("merging"))
            .count();

        assertThat(result.totalCandidates()).isEqualTo(20);
        assertThat(result.atoms()).hasSizeLessThanOrEqualTo(8);
        assertThat(relevantHits / 8.0).isGreaterThanOrEqualTo(0.88);
    }
}
