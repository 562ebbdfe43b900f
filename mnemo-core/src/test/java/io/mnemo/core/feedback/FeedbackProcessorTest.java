package io.mnemo.core.feedback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemo.core.atom.InMemoryAtomRepository;
import io.mnemo.core.atom.MemoryAtom;
import io.mnemo.core.atom.Sensitivity;
import io.mnemo.core.querylog.InMemoryQueryLogStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FeedbackProcessorTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private InMemoryAtomRepository atoms;
    private InMemoryQueryLogStore queryLog;
    private FeedbackProcessor processor;

    @BeforeEach
    void setUp() {
        atoms = new InMemoryAtomRepository();
        queryLog = new InMemoryQueryLogStore();
        processor = new FeedbackProcessor(atoms, queryLog, Clock.fixed(NOW, ZoneOffset.UTC));
        atoms.upsert(new MemoryAtom("a1", "project_a", null, null, null, "Run lint.", null, List.of(), null, 0.8,
            null, false, 1_000L, 1_000L, null));
    }

    @Test
    void shouldPinThenUnpin() throws Exception {
        processor.apply("project_a", new FeedbackRequest("s1", "mq_1", "a1", FeedbackType.PIN, null));
        assertThat(atoms.findById("a1").orElseThrow().pinned()).isTrue();

        processor.apply("project_a", new FeedbackRequest("s1", "mq_1", "a1", FeedbackType.UNPIN, null));
        assertThat(atoms.findById("a1").orElseThrow().pinned()).isFalse();
    }

    @Test
    void shouldHideByRestrictingSensitivity() throws Exception {
        processor.apply("project_a", new FeedbackRequest("s1", "mq_1", "a1", FeedbackType.HIDE, "not relevant"));

        MemoryAtom hidden = atoms.findById("a1").orElseThrow();
        assertThat(hidden.sensitivity()).isEqualTo(Sensitivity.RESTRICTED);
        assertThat(hidden.updatedAt()).isEqualTo(1_000L);
    }

    @Test
    void shouldOnlyLogRatingsAndConflictReports() throws Exception {
        MemoryAtom before = atoms.findById("a1").orElseThrow();

        MemoryFeedback positive = processor.apply("project_a", new FeedbackRequest("s1", "mq_1", "a1", FeedbackType.POSITIVE, null));
        processor.apply("project_a", new FeedbackRequest("s1", "mq_1", "a1", FeedbackType.REPORT_CONFLICT, "contradicts a2"));

        assertThat(atoms.findById("a1")).contains(before);
        assertThat(positive.id()).startsWith("mfb_");
        assertThat(positive.createdAt()).isEqualTo(NOW.toEpochMilli());
        assertThat(queryLog.listFeedbackForQuery("mq_1")).hasSize(2);
    }

    @Test
    void shouldRecordFeedbackForUnknownAtom() throws Exception {
        MemoryFeedback feedback = processor.apply("project_a", new FeedbackRequest(null, "mq_9", "ghost", FeedbackType.PIN, null));

        assertThat(feedback.sessionId()).isEmpty();
        assertThat(queryLog.listFeedbackForQuery("mq_9")).containsExactly(feedback);
        assertThat(atoms.findById("ghost")).isEmpty();
    }

    @Test
    void shouldNotTouchAtomsOfAnotherProject() throws Exception {
        MemoryAtom before = atoms.findById("a1").orElseThrow();

        MemoryFeedback feedback = processor.apply("project_b", new FeedbackRequest("s2", "mq_2", "a1", FeedbackType.HIDE, null));

        assertThat(atoms.findById("a1")).contains(before);
        assertThat(queryLog.listFeedbackForQuery("mq_2")).containsExactly(feedback);
    }

    @Test
    void shouldRejectUnknownFeedbackKinds() {
        assertThatThrownBy(() -> FeedbackType.fromWire("meh"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown feedback type: meh");
        assertThat(FeedbackType.fromWire(" Report_Conflict ")).isEqualTo(FeedbackType.REPORT_CONFLICT);
        assertThatThrownBy(() -> new FeedbackRequest("s", "q", " ", FeedbackType.PIN, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
