package io.mnemo.core.feedback;

import io.mnemo.core.atom.AtomRepository;
import io.mnemo.core.atom.MemoryAtom;
import io.mnemo.core.atom.Sensitivity;
import io.mnemo.core.querylog.QueryLogStore;
import java.io.IOException;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records user feedback on retrieved atoms and applies the state changes it
 * implies: pin, unpin, and hide (mark restricted). Other kinds are only logged,
 * as is feedback on an atom outside the given project.
 */
public final class FeedbackProcessor {
    private static final Logger LOG = LoggerFactory.getLogger(FeedbackProcessor.class);

    private final AtomRepository atoms;
    private final QueryLogStore queryLog;
    private final Clock clock;

    public FeedbackProcessor(AtomRepository atoms, QueryLogStore queryLog, Clock clock) {
        this.atoms = Objects.requireNonNull(atoms, "atoms must not be null");
        this.queryLog = Objects.requireNonNull(queryLog, "queryLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public MemoryFeedback apply(String projectId, FeedbackRequest request) throws IOException {
        MemoryFeedback feedback = new MemoryFeedback(
            "mfb_" + UUID.randomUUID(),
            request.sessionId(),
            request.queryId(),
            request.atomId(),
            request.feedback(),
            request.note(),
            clock.millis()
        );
        queryLog.addFeedback(feedback);

        Optional<MemoryAtom> target = atoms.findById(request.atomId())
            .filter(atom -> atom.projectId().equals(projectId));
        if (target.isEmpty()) {
            LOG.debug(
                "Feedback {} recorded for atom {} not found in {}",
                request.feedback().wireValue(),
                request.atomId(),
                projectId
            );
            return feedback;
        }

        MemoryAtom atom = target.get();
        MemoryAtom updated = switch (request.feedback()) {
            case PIN -> atom.withPinned(true);
            case UNPIN -> atom.withPinned(false);
            case HIDE -> atom.withSensitivity(Sensitivity.RESTRICTED);
            default -> atom;
        };
        if (!updated.equals(atom)) {
            atoms.upsert(updated);
            LOG.debug("Applied {} feedback to atom {}", request.feedback().wireValue(), atom.id());
        }
        return feedback;
    }
}
