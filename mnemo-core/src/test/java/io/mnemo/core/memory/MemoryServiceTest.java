package io.mnemo.core.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemo.core.atom.MemoryAtom;
import io.mnemo.core.atom.Sensitivity;
import io.mnemo.core.consolidation.ConsolidationResult;
import io.mnemo.core.consolidation.ConsolidationRunStatus;
import io.mnemo.core.feedback.FeedbackRequest;
import io.mnemo.core.feedback.FeedbackType;
import io.mnemo.core.retrieval.MemoryQueryResult;
import io.mnemo.core.retrieval.QueryOptions;
import io.mnemo.core.store.MemoryStores;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MemoryServiceTest {
    private static final Instant START = Instant.parse("2026-03-01T09:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private MemoryStores stores;
    private MemoryService service;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(START);
        stores = MemoryStores.inMemory();
        service = new MemoryService(tempDir, stores, clock);
        service.initialize();
    }

    @Test
    void shouldRejectCallsBeforeInitialize() {
        MemoryService fresh = new MemoryService(tempDir, MemoryStores.inMemory(), clock);

        assertThat(fresh.isInitialized()).isFalse();
        assertThatThrownBy(fresh::getAll)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("initialize()");
    }

    @Test
    void shouldCreateMemoryAndCountReads() throws Exception {
        Memory created = service.create(new CreateMemoryInput(
            "Package manager", "Use pnpm for every install.", null, List.of("tooling"), MemorySource.MANUAL
        ));

        assertThat(created.group()).isEqualTo(MemoryGroups.LEARNINGS);
        assertThat(created.confidence()).isEqualTo(1.0);
        assertThat(created.createdAt()).isEqualTo(START);

        service.read(created.id());
        clock.advance(Duration.ofMinutes(5));
        Optional<Memory> second = service.read(created.id());

        assertThat(second).isPresent();
        assertThat(second.get().accessCount()).isEqualTo(2);
        assertThat(second.get().lastAccessedAt()).isEqualTo(START.plus(Duration.ofMinutes(5)));
        assertThat(service.read("missing")).isEmpty();
    }

    @Test
    void shouldDefaultAutoMemoriesToLowerConfidence() throws Exception {
        Memory auto = service.upsertAutoMemory(new CreateMemoryInput(
            "Observed", "The build runs on JDK 17.", MemoryGroups.CONTEXT, null, MemorySource.MANUAL
        ));

        assertThat(auto.source()).isEqualTo(MemorySource.AUTO);
        assertThat(auto.confidence()).isEqualTo(0.7);
    }

    @Test
    void shouldRejectBlankContentOrTitle() {
        assertThatThrownBy(() -> service.create(new CreateMemoryInput("Title", "   ", null, null, null)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.create(new CreateMemoryInput(" ", "Some content", null, null, null)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFoldExactDuplicateAndUnionTags() throws Exception {
        Memory first = service.create(new CreateMemoryInput(
            "Installs", "Use pnpm for installs.", null, List.of("tooling"), MemorySource.MANUAL
        ));
        clock.advance(Duration.ofHours(1));
        Memory second = service.create(new CreateMemoryInput(
            "Installs again", "use PNPM for installs", MemoryGroups.CONTEXT, List.of("pnpm", "tooling"), MemorySource.MANUAL
        ));

        assertThat(second.id()).isEqualTo(first.id());
        assertThat(second.tags()).containsExactly("tooling", "pnpm");
        assertThat(second.title()).isEqualTo("Installs");
        assertThat(second.content()).isEqualTo("Use pnpm for installs.");
        assertThat(second.updatedAt()).isEqualTo(START.plus(Duration.ofHours(1)));
        assertThat(service.getAll()).hasSize(1);
    }

    @Test
    void shouldPreferLongerContentForNearDuplicateInSameGroup() throws Exception {
        Memory first = service.create(new CreateMemoryInput(
            "Release", "always run the full integration test suite before release tagging", null, null, null
        ));
        Memory merged = service.create(new CreateMemoryInput(
            "Release", "always run the full integration test suite before release tagging today", null, null, null
        ));

        assertThat(merged.id()).isEqualTo(first.id());
        assertThat(merged.content()).endsWith("tagging today");
        assertThat(service.getAll()).hasSize(1);
    }

    @Test
    void shouldKeepNearDuplicatesInDifferentGroupsApart() throws Exception {
        service.create(new CreateMemoryInput(
            "Release", "always run the full integration test suite before release tagging", null, null, null
        ));
        service.create(new CreateMemoryInput(
            "Release", "always run the full integration test suite before release tagging today",
            MemoryGroups.INSTRUCTIONS, null, null
        ));

        assertThat(service.getAll()).hasSize(2);
    }

    @Test
    void shouldUpgradeTitleOfAutoMemoryOnManualDuplicate() throws Exception {
        Memory auto = service.create(new CreateMemoryInput(
            "Derived title", "Deploys happen on Tuesdays.", null, null, MemorySource.AUTO
        ));
        Memory manual = service.create(new CreateMemoryInput(
            "Deploy day", "Deploys happen on Tuesdays.", null, null, MemorySource.MANUAL
        ));

        assertThat(manual.id()).isEqualTo(auto.id());
        assertThat(manual.title()).isEqualTo("Deploy day");
        assertThat(manual.source()).isEqualTo(MemorySource.AUTO);
    }

    @Test
    void shouldUpdateFieldsAndLinks() throws Exception {
        Memory created = service.create(new CreateMemoryInput("Style", "Prefer records.", null, null, null));
        clock.advance(Duration.ofMinutes(1));

        Optional<Memory> updated = service.update(created.id(), new UpdateMemoryInput(
            null, "Prefer records for value types.", List.of("java"), MemoryGroups.PREFERENCES, 1.7, List.of("m1", "m2"), null
        ));
        Optional<Memory> unlinked = service.update(created.id(), new UpdateMemoryInput(
            null, null, null, null, null, null, List.of("m1")
        ));

        assertThat(updated).isPresent();
        assertThat(updated.get().group()).isEqualTo(MemoryGroups.PREFERENCES);
        assertThat(updated.get().confidence()).isEqualTo(1.0);
        assertThat(updated.get().updatedAt()).isEqualTo(START.plus(Duration.ofMinutes(1)));
        assertThat(unlinked.get().relatedMemoryIds()).containsExactly("m2");
        assertThat(unlinked.get().content()).isEqualTo("Prefer records for value types.");
        assertThat(service.update("missing", UpdateMemoryInput.tags(List.of("x")))).isEmpty();
        assertThatThrownBy(() -> service.update(created.id(), UpdateMemoryInput.content(" ")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDeleteOnlyOnce() throws Exception {
        Memory created = service.create(new CreateMemoryInput("Temp", "Scratch note.", null, null, null));

        assertThat(service.delete(created.id())).isTrue();
        assertThat(service.delete(created.id())).isFalse();
        assertThat(service.getAll()).isEmpty();
    }

    @Test
    void shouldManageCustomGroups() throws Exception {
        service.createGroup("research");
        service.create(new CreateMemoryInput("Paper", "Read the consensus paper.", "research", null, null));
        service.create(new CreateMemoryInput("Other", "Unrelated learning.", null, null, null));

        assertThat(service.listGroups())
            .containsExactly("preferences", "learnings", "context", "instructions", "research");
        assertThat(service.getMemoriesByGroup("research")).extracting(Memory::title).containsExactly("Paper");

        assertThat(service.deleteGroup("research")).isEqualTo(1);
        assertThat(service.listGroups()).containsExactly("preferences", "learnings", "context", "instructions");
        assertThat(service.getAll()).extracting(Memory::title).containsExactly("Other");
        assertThatThrownBy(() -> service.deleteGroup("learnings"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Cannot delete default group: learnings");
    }

    @Test
    void shouldRegisterGroupImplicitlyOnCreate() throws Exception {
        service.create(new CreateMemoryInput("Infra", "Clusters run in eu-west-1.", "ops", null, null));

        assertThat(service.listGroups()).endsWith("ops");
    }

    @Test
    void shouldFilterSearchResults() throws Exception {
        service.create(new CreateMemoryInput("Lint", "Run lint before pushing.", null, List.of("ci"), MemorySource.MANUAL));
        service.create(new CreateMemoryInput("Tone", "Keep answers short.", MemoryGroups.PREFERENCES, List.of("style"),
            MemorySource.AUTO, 0.4, null));

        assertThat(service.search(MemorySearchOptions.query("LINT"))).extracting(Memory::title).containsExactly("Lint");
        assertThat(service.search(new MemorySearchOptions(null, null, null, 0.5, null, null)))
            .extracting(Memory::title).containsExactly("Lint");
        assertThat(service.search(new MemorySearchOptions(null, List.of(MemoryGroups.PREFERENCES), null, null, null, null)))
            .extracting(Memory::title).containsExactly("Tone");
        assertThat(service.search(new MemorySearchOptions(null, null, MemorySource.AUTO, null, List.of("style"), 1)))
            .extracting(Memory::title).containsExactly("Tone");
        assertThat(service.search(MemorySearchOptions.query("absent"))).isEmpty();
    }

    @Test
    void shouldLogDeepQueryAndHonourHideFeedback() throws Exception {
        Memory memory = service.create(new CreateMemoryInput(
            "Package manager", "Use pnpm for package installs.", null, List.of("pnpm"), MemorySource.MANUAL
        ));

        MemoryQueryResult first = service.deepQuery("session-1", "pnpm package installs", QueryOptions.defaults());
        assertThat(first.queryId()).startsWith("mq_");
        assertThat(first.atoms()).extracting(MemoryAtom::id).containsExactly(memory.id());
        assertThat(first.evidence().get(0).reasons()).contains("group:learnings", "confidence:1.00", "tag:pnpm");
        assertThat(stores.queryLog().findQuery(first.queryId())).isPresent();

        service.applyFeedback(new FeedbackRequest("session-1", first.queryId(), memory.id(), FeedbackType.HIDE, null));

        MemoryQueryResult hidden = service.deepQuery("session-1", "pnpm package installs", QueryOptions.defaults());
        MemoryQueryResult withSensitive = service.deepQuery(
            "session-1", "pnpm package installs", QueryOptions.builder().includeSensitive(true).build()
        );
        assertThat(hidden.atoms()).isEmpty();
        assertThat(hidden.totalCandidates()).isZero();
        assertThat(withSensitive.atoms()).extracting(MemoryAtom::id).containsExactly(memory.id());
        assertThat(stores.queryLog().listFeedbackForQuery(first.queryId())).hasSize(1);
    }

    @Test
    void shouldPinThroughFeedback() throws Exception {
        Memory memory = service.create(new CreateMemoryInput("Pinned", "Never force push main.", null, null, null));

        service.applyFeedback(new FeedbackRequest(null, null, memory.id(), FeedbackType.PIN, "important"));

        assertThat(stores.atoms().findById(memory.id())).hasValueSatisfying(atom -> assertThat(atom.pinned()).isTrue());
    }

    @Test
    void shouldScoreRelevantMemoriesAndSkipEmptyContext() throws Exception {
        service.create(new CreateMemoryInput("Docker", "Build images with docker buildx.", null, null, null));
        service.create(new CreateMemoryInput("Tone", "Keep answers short.", null, null, null));

        List<ScoredMemory> relevant = service.getRelevantMemories("how do I build docker images", 5);

        assertThat(relevant).extracting(scored -> scored.memory().title()).containsExactly("Docker");
        assertThat(service.getRelevantMemories("  ", 5)).isEmpty();
    }

    @Test
    void shouldRunPeriodicConsolidationOnlyWhenDue() throws Exception {
        service.create(new CreateMemoryInput("Note", "Something worth keeping.", null, null, null));
        PeriodicConsolidationOptions options = new PeriodicConsolidationOptions(true, 360, false, null, null);

        Optional<ConsolidationResult> first = service.maybeRunPeriodicConsolidation(options);
        clock.advance(Duration.ofHours(1));
        Optional<ConsolidationResult> tooSoon = service.maybeRunPeriodicConsolidation(options);
        clock.advance(Duration.ofHours(5));
        Optional<ConsolidationResult> due = service.maybeRunPeriodicConsolidation(options);

        assertThat(first).isPresent();
        assertThat(tooSoon).isEmpty();
        assertThat(due).isPresent();
        assertThat(service.listConsolidationRuns(10))
            .hasSize(2)
            .allSatisfy(run -> assertThat(run.status()).isEqualTo(ConsolidationRunStatus.COMPLETED));
    }

    @Test
    void shouldSkipDisabledPeriodicConsolidationUnlessForced() throws Exception {
        PeriodicConsolidationOptions disabled = new PeriodicConsolidationOptions(false, 60, false, null, null);
        PeriodicConsolidationOptions forced = new PeriodicConsolidationOptions(false, 60, true, null, null);

        assertThat(service.maybeRunPeriodicConsolidation(disabled)).isEmpty();
        assertThat(service.maybeRunPeriodicConsolidation(forced)).isPresent();
        assertThat(service.maybeRunPeriodicConsolidation(forced)).isPresent();
    }

    @Test
    void shouldRecordRelatedSessionsOnce() throws Exception {
        Memory memory = service.create(new CreateMemoryInput("Note", "Sessions link here.", null, null, null));

        service.addRelatedSession(memory.id(), "s1");
        service.addRelatedSession(memory.id(), "s1");
        service.addRelatedSession(memory.id(), "s2");
        service.addRelatedSession("missing", "s3");

        assertThat(service.read(memory.id()).orElseThrow().relatedSessionIds()).containsExactly("s1", "s2");
    }

    @Test
    void shouldBuildPromptSection() throws Exception {
        assertThat(service.buildMemoryPromptSection(null)).isEmpty();

        service.create(new CreateMemoryInput("Docker", "Build images with docker buildx.", null, null, null));
        String all = service.buildMemoryPromptSection(null);
        String scored = service.buildMemoryPromptSection("docker buildx images");

        assertThat(all).startsWith("## Relevant Memories\n\n")
            .contains("### Docker\n*Group: learnings | Tags: none*\n\nBuild images with docker buildx.");
        assertThat(scored).contains("### Docker (relevance: ").doesNotContain("### Docker\n");
    }

    @Test
    void shouldIsolateProjectsSharingOneStore() throws Exception {
        Path otherDir = Files.createDirectories(tempDir.resolve("other"));
        MemoryService other = new MemoryService(otherDir, stores, clock);
        other.initialize();

        Memory mine = service.create(new CreateMemoryInput("Mine", "Only in the first project.", null, null, null));

        assertThat(other.getProjectId()).isNotEqualTo(service.getProjectId());
        assertThat(other.getAll()).isEmpty();
        assertThat(other.read(mine.id())).isEmpty();
        assertThat(other.delete(mine.id())).isFalse();
    }

    @Test
    void shouldIgnoreFeedbackFromAnotherProject() throws Exception {
        Path otherDir = Files.createDirectories(tempDir.resolve("other"));
        MemoryService other = new MemoryService(otherDir, stores, clock);
        other.initialize();
        Memory mine = service.create(new CreateMemoryInput("Mine", "Only in the first project.", null, null, null));

        other.applyFeedback(new FeedbackRequest("s1", "mq_1", mine.id(), FeedbackType.HIDE, null));
        other.applyFeedback(new FeedbackRequest("s1", "mq_1", mine.id(), FeedbackType.PIN, null));

        MemoryAtom stored = stores.atoms().findById(mine.id()).orElseThrow();
        assertThat(stored.sensitivity()).isEqualTo(Sensitivity.NORMAL);
        assertThat(stored.pinned()).isFalse();
        assertThat(stores.queryLog().listFeedbackForQuery("mq_1")).hasSize(2);
    }
}
