package io.mnemo.core.consolidation;

import io.mnemo.core.atom.AtomRepository;
import io.mnemo.core.atom.MemoryAtom;
import io.mnemo.core.atom.Provenance;
import io.mnemo.core.text.TextSimilarity;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Batch pass over one project's atoms: merges near-duplicates into the
 * higher-priority atom, then decays the confidence of stale unpinned survivors.
 *
 * <p>Pinned atoms are never deleted or decayed, and two pinned atoms are never
 * merged. Each write is independent, so a run that fails part way keeps the
 * merges and decays it already made.
 */
public final class ConsolidationService {
    private static final Logger LOG = LoggerFactory.getLogger(ConsolidationService.class);
    static final String CONSOLIDATOR = "memory_consolidator_v1";
    static final String MERGED_TAG = "consolidated:merged";
    static final String DECAYED_TAG = "consolidated:decayed";
    private static final double DECAY_EPSILON = 1e-6;

    /**
     * Pinned first, then higher confidence, then most recently updated.
     */
    static final Comparator<MemoryAtom> PRIORITY = (a, b) -> {
        if (a.pinned() != b.pinned()) {
            return a.pinned() ? -1 : 1;
        }
        if (a.confidence() != b.confidence()) {
            return Double.compare(b.confidence(), a.confidence());
        }
        return Long.compare(b.updatedAt(), a.updatedAt());
    };

    private final AtomRepository atoms;
    private final ConsolidationRunStore runs;
    private final Clock clock;

    public ConsolidationService(AtomRepository atoms, ConsolidationRunStore runs, Clock clock) {
        this.atoms = Objects.requireNonNull(atoms, "atoms must not be null");
        this.runs = Objects.requireNonNull(runs, "runs must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ConsolidationResult run(String projectId, ConsolidationPolicy policy) throws IOException {
        return run(projectId, policy, ConsolidationBudget.unbounded());
    }

    /**
     * Runs one consolidation pass and records it in the run history. A failure,
     * cancellation included, is recorded as {@code failed} and rethrown.
     */
    public ConsolidationResult run(String projectId, ConsolidationPolicy policy, ConsolidationBudget budget)
        throws IOException {
        ConsolidationPolicy resolved = policy == null ? ConsolidationPolicy.defaults() : policy;
        ConsolidationBudget safeBudget = budget == null ? ConsolidationBudget.unbounded() : budget;
        long startedAt = clock.millis();
        String runId = "mcon_" + UUID.randomUUID().toString().substring(0, 8);

        runs.begin(runId, projectId, startedAt);
        try {
            ConsolidationResult result = execute(runId, projectId, resolved, safeBudget, startedAt);
            runs.complete(runId, result, result.completedAt());
            LOG.info(
                "Consolidation {} for {} ({}): {} -> {} atoms, merged={}, decayed={}, pinned={}",
                runId,
                projectId,
                resolved.strategy().wireValue(),
                result.beforeCount(),
                result.afterCount(),
                result.mergedCount(),
                result.decayedCount(),
                result.preservedPinnedCount()
            );
            return result;
        } catch (IOException | RuntimeException e) {
            recordFailure(runId, e);
            throw e;
        }
    }

    private ConsolidationResult execute(
        String runId,
        String projectId,
        ConsolidationPolicy policy,
        ConsolidationBudget budget,
        long nowMs
    ) throws IOException {
        long startedNanos = budget.start();
        List<MemoryAtom> snapshot = atoms.listAllByProject(projectId);
        int beforeCount = snapshot.size();
        int preservedPinnedCount = (int) snapshot.stream().filter(MemoryAtom::pinned).count();

        List<MemoryAtom> sorted = new ArrayList<>(snapshot);
        sorted.sort(PRIORITY);
        List<Survivor> survivors = new ArrayList<>();
        Set<String> removedIds = new HashSet<>();
        int mergedCount = 0;
        int removedCount = 0;

        for (MemoryAtom atom : sorted) {
            budget.check(startedNanos);
            if (removedIds.contains(atom.id())) {
                continue;
            }
            Survivor current = new Survivor(atom);
            Survivor match = findMatch(survivors, current, policy.redundancyThreshold());
            if (match == null) {
                survivors.add(current);
                continue;
            }

            MemoryAtom primary = PRIORITY.compare(match.atom, atom) <= 0 ? match.atom : atom;
            MemoryAtom secondary = primary.id().equals(atom.id()) ? match.atom : atom;
            if (secondary.pinned() && !primary.id().equals(secondary.id())) {
                survivors.add(current);
                continue;
            }

            MemoryAtom merged = merge(primary, secondary, nowMs);
            atoms.upsert(merged);
            if (atoms.delete(secondary.id())) {
                removedIds.add(secondary.id());
                removedCount++;
            }
            mergedCount++;
            LOG.debug("Merged atom {} into {}", secondary.id(), primary.id());

            if (!primary.id().equals(match.atom.id())) {
                match.replace(merged);
            } else {
                match.atom = merged;
            }
        }

        int decayedCount = 0;
        long staleCutoff = nowMs - policy.staleAfterMillis();
        for (Survivor survivor : survivors) {
            budget.check(startedNanos);
            MemoryAtom atom = survivor.atom;
            if (atom.pinned() || atom.updatedAt() >= staleCutoff) {
                continue;
            }
            double decayed = Math.max(policy.minConfidence(), atom.confidence() * policy.decayFactor());
            if (decayed >= atom.confidence() - DECAY_EPSILON) {
                continue;
            }
            atoms.upsert(atom
                .withConfidence(decayed, nowMs)
                .withProvenance(atom.provenance().withTag(DECAYED_TAG, CONSOLIDATOR)));
            decayedCount++;
        }

        int afterCount = Math.max(0, beforeCount - removedCount);
        double redundancyReduction = beforeCount > 0 ? (double) removedCount / beforeCount : 0.0;
        int orphanedRemovals = Math.max(0, removedCount - mergedCount);
        double recallRetention = beforeCount > 0 ? Math.max(0.0, 1.0 - (double) orphanedRemovals / beforeCount) : 1.0;

        return new ConsolidationResult(
            runId,
            policy.strategy(),
            nowMs,
            clock.millis(),
            beforeCount,
            afterCount,
            mergedCount,
            removedCount,
            decayedCount,
            preservedPinnedCount,
            redundancyReduction,
            recallRetention
        );
    }

    private static Survivor findMatch(List<Survivor> survivors, Survivor current, double threshold) {
        MemoryAtom atom = current.atom;
        for (Survivor candidate : survivors) {
            if (candidate.atom.atomType() != atom.atomType()) {
                continue;
            }
            if (candidate.atom.pinned() && atom.pinned()) {
                continue;
            }
            boolean exact = !current.normalized.isEmpty() && current.normalized.equals(candidate.normalized);
            double similarity = exact ? 1.0 : TextSimilarity.jaccard(current.tokens, candidate.tokens);
            if (similarity >= threshold) {
                return candidate;
            }
        }
        return null;
    }

    static MemoryAtom merge(MemoryAtom primary, MemoryAtom duplicate, long nowMs) {
        Set<String> keywords = new LinkedHashSet<>(primary.keywords());
        keywords.addAll(duplicate.keywords());

        Set<String> tags = new LinkedHashSet<>(primary.provenance().tags());
        tags.addAll(duplicate.provenance().tags());
        tags.add(MERGED_TAG);

        String primarySummary = primary.summary();
        String duplicateSummary = duplicate.summary() == null ? "" : duplicate.summary();
        String summary = primarySummary != null && !primarySummary.isEmpty()
            && primarySummary.length() >= duplicateSummary.length()
            ? primarySummary
            : duplicateSummary.isEmpty() ? primarySummary : duplicateSummary;

        String primaryRef = primary.provenance().sourceRef();
        String sourceRef = primaryRef != null && !primaryRef.isEmpty() ? primaryRef : duplicate.provenance().sourceRef();

        return new MemoryAtom(
            primary.id(),
            primary.projectId(),
            primary.sessionId(),
            primary.runId(),
            primary.atomType(),
            primary.content(),
            summary,
            List.copyOf(keywords),
            new Provenance(primary.provenance().source(), sourceRef, List.copyOf(tags), CONSOLIDATOR),
            Math.max(primary.confidence(), duplicate.confidence()),
            primary.sensitivity(),
            primary.pinned(),
            primary.createdAt(),
            nowMs,
            primary.expiresAt()
        );
    }

    private void recordFailure(String runId, Exception failure) {
        String message = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
        LOG.warn("Consolidation {} failed: {}", runId, message);
        try {
            runs.fail(runId, message, clock.millis());
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private static final class Survivor {
        private MemoryAtom atom;
        private String normalized;
        private Set<String> tokens;

        private Survivor(MemoryAtom atom) {
            replace(atom);
        }

        private void replace(MemoryAtom value) {
            this.atom = value;
            this.normalized = TextSimilarity.normalize(value.content());
            this.tokens = TextSimilarity.tokenize(value.content());
        }
    }
}
