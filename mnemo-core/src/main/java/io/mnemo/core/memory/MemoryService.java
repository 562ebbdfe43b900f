package io.mnemo.core.memory;

import io.mnemo.core.atom.AtomRepository;
import io.mnemo.core.atom.MemoryAtom;
import io.mnemo.core.atom.Sensitivity;
import io.mnemo.core.consolidation.ConsolidationBudget;
import io.mnemo.core.consolidation.ConsolidationPolicy;
import io.mnemo.core.consolidation.ConsolidationResult;
import io.mnemo.core.consolidation.ConsolidationRun;
import io.mnemo.core.consolidation.ConsolidationRunStore;
import io.mnemo.core.consolidation.ConsolidationService;
import io.mnemo.core.feedback.FeedbackProcessor;
import io.mnemo.core.feedback.FeedbackRequest;
import io.mnemo.core.feedback.MemoryFeedback;
import io.mnemo.core.querylog.QueryLogStore;
import io.mnemo.core.retrieval.HybridRelevanceScorer;
import io.mnemo.core.retrieval.LexicalRanker;
import io.mnemo.core.retrieval.MemoryQueryResult;
import io.mnemo.core.retrieval.QueryEvidence;
import io.mnemo.core.retrieval.QueryOptions;
import io.mnemo.core.retrieval.RetrievalWeights;
import io.mnemo.core.retrieval.TermMatchLexicalRanker;
import io.mnemo.core.settings.ProjectState;
import io.mnemo.core.settings.ProjectStateStore;
import io.mnemo.core.store.MemoryStores;
import io.mnemo.core.text.TextSimilarity;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Long-term memory engine for one project. Creates go through the dedup gate,
 * retrieval through the hybrid scorer, and mutations of the project's atoms are
 * serialized by the project's lock.
 */
public final class MemoryService {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryService.class);
    public static final int DEFAULT_RELEVANT_LIMIT = 5;
    private static final int MAX_EVIDENCE_TAGS = 3;

    private final Path workingDir;
    private final String projectId;
    private final AtomRepository atoms;
    private final QueryLogStore queryLog;
    private final ConsolidationRunStore consolidationRuns;
    private final ProjectStateStore projectState;
    private final ConsolidationService consolidation;
    private final FeedbackProcessor feedback;
    private final DedupGate dedup;
    private final HybridRelevanceScorer scorer;
    private final ProjectLocks locks;
    private final Clock clock;
    private volatile boolean initialized;

    public MemoryService(Path workingDir, MemoryStores stores, Clock clock) {
        this(workingDir, stores, new ProjectLocks(), clock, new TermMatchLexicalRanker());
    }

    public MemoryService(
        Path workingDir,
        MemoryStores stores,
        ProjectLocks locks,
        Clock clock,
        LexicalRanker lexicalRanker
    ) {
        Objects.requireNonNull(stores, "stores must not be null");
        this.workingDir = workingDir.toAbsolutePath().normalize();
        this.projectId = ProjectIds.fromWorkingDirectory(this.workingDir);
        this.atoms = stores.atoms();
        this.queryLog = stores.queryLog();
        this.consolidationRuns = stores.consolidationRuns();
        this.projectState = new ProjectStateStore(stores.settings());
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.locks = Objects.requireNonNull(locks, "locks must not be null");
        this.consolidation = new ConsolidationService(atoms, consolidationRuns, clock);
        this.feedback = new FeedbackProcessor(atoms, queryLog, clock);
        this.dedup = new DedupGate();
        this.scorer = new HybridRelevanceScorer(lexicalRanker);
    }

    public void initialize() throws IOException {
        ProjectState state = projectState.load(projectId);
        initialized = true;
        LOG.info("Memory engine ready for {} ({}), {} custom groups", workingDir, projectId, state.customGroups().size());
    }

    public boolean isInitialized() {
        return initialized;
    }

    public String getProjectId() {
        return projectId;
    }

    public Path getWorkingDir() {
        return workingDir;
    }

    /**
     * Stores a memory, or folds it into an existing exact or near duplicate and
     * returns the merged memory.
     */
    public Memory create(CreateMemoryInput input) throws IOException {
        ensureInitialized();
        Objects.requireNonNull(input, "input must not be null");
        if (input.content().isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        if (input.title().isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        return withProjectLock(() -> {
            Instant now = clock.instant();
            List<MemoryAtom> projectAtoms = atoms.listAllByProject(projectId);
            Optional<MemoryAtom> duplicate = dedup.findDuplicate(projectAtoms, input);
            if (duplicate.isPresent()) {
                MemoryAtom existingAtom = duplicate.get();
                Memory merged = dedup.merge(MemoryMapper.toMemory(existingAtom), input, now);
                atoms.upsert(MemoryMapper.toAtom(merged, projectId, existingAtom));
                LOG.debug("Merged create request into existing memory {}", merged.id());
                return merged;
            }

            Memory memory = new Memory(
                UUID.randomUUID().toString(),
                input.title(),
                input.content(),
                input.group(),
                input.tags(),
                input.source(),
                TextSimilarity.clamp01(input.resolvedConfidence()),
                now,
                now,
                0,
                now,
                List.of(),
                input.relatedMemoryIds()
            );
            atoms.upsert(MemoryMapper.toAtom(memory, projectId, null));
            registerGroup(memory.group());
            return memory;
        });
    }

    public Memory upsertAutoMemory(CreateMemoryInput input) throws IOException {
        return create(input.withSource(MemorySource.AUTO));
    }

    /**
     * Reads a memory and records the access. The lookup and the access write
     * happen under the project lock, so a memory absorbed by a concurrent merge
     * stays deleted. A failed access write is logged and the memory is still
     * returned.
     */
    public Optional<Memory> read(String id) throws IOException {
        ensureInitialized();
        return withProjectLock(() -> {
            Optional<MemoryAtom> found = findOwnAtom(id);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            MemoryAtom atom = found.get();
            Memory memory = MemoryMapper.toMemory(atom);
            Memory accessed = memory.withAccess(memory.accessCount() + 1, clock.instant());
            try {
                atoms.upsert(MemoryMapper.toAtom(accessed, projectId, atom));
            } catch (IOException e) {
                LOG.debug("Skipped access bookkeeping for memory {}: {}", id, e.getMessage());
            }
            return Optional.of(accessed);
        });
    }

    public Optional<Memory> update(String id, UpdateMemoryInput updates) throws IOException {
        ensureInitialized();
        Objects.requireNonNull(updates, "updates must not be null");
        if (updates.content() != null && updates.content().isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        return withProjectLock(() -> {
            Optional<MemoryAtom> found = findOwnAtom(id);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            MemoryAtom atom = found.get();
            Memory current = MemoryMapper.toMemory(atom);

            List<String> relatedMemoryIds = new ArrayList<>(current.relatedMemoryIds());
            if (updates.addRelatedMemoryIds() != null) {
                Set<String> merged = new LinkedHashSet<>(relatedMemoryIds);
                merged.addAll(updates.addRelatedMemoryIds());
                relatedMemoryIds = new ArrayList<>(merged);
            }
            if (updates.removeRelatedMemoryIds() != null) {
                relatedMemoryIds.removeAll(updates.removeRelatedMemoryIds());
            }
            String group = updates.group() == null || updates.group().isBlank()
                ? current.group()
                : updates.group().trim();

            Memory updated = new Memory(
                current.id(),
                updates.title() == null ? current.title() : updates.title(),
                updates.content() == null ? current.content() : updates.content(),
                group,
                updates.tags() == null ? current.tags() : updates.tags(),
                current.source(),
                updates.confidence() == null ? current.confidence() : TextSimilarity.clamp01(updates.confidence()),
                current.createdAt(),
                clock.instant(),
                current.accessCount(),
                current.lastAccessedAt(),
                current.relatedSessionIds(),
                relatedMemoryIds
            );
            atoms.upsert(MemoryMapper.toAtom(updated, projectId, atom));
            registerGroup(group);
            return Optional.of(updated);
        });
    }

    public boolean delete(String id) throws IOException {
        ensureInitialized();
        return withProjectLock(() -> findOwnAtom(id).isPresent() && atoms.delete(id));
    }

    public void createGroup(String name) throws IOException {
        ensureInitialized();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("group name must not be blank");
        }
        withProjectLock(() -> {
            registerGroup(name.trim());
            return null;
        });
    }

    /**
     * Deletes a custom group together with every memory in it.
     *
     * @return number of memories deleted
     */
    public int deleteGroup(String name) throws IOException {
        ensureInitialized();
        if (MemoryGroups.isDefault(name)) {
            throw new IllegalArgumentException("Cannot delete default group: " + name);
        }
        return withProjectLock(() -> {
            int deleted = 0;
            for (MemoryAtom atom : atoms.listAllByProject(projectId)) {
                if (MemoryMapper.toMemory(atom).group().equals(name) && atoms.delete(atom.id())) {
                    deleted++;
                }
            }
            ProjectState state = projectState.load(projectId);
            if (state.customGroups().contains(name)) {
                projectState.save(projectId, state.withoutGroup(name));
            }
            LOG.debug("Deleted group {} with {} memories", name, deleted);
            return deleted;
        });
    }

    /**
     * The four default groups followed by this project's custom groups in sorted order.
     */
    public List<String> listGroups() throws IOException {
        ensureInitialized();
        Set<String> groups = new LinkedHashSet<>(MemoryGroups.DEFAULTS);
        groups.addAll(projectState.load(projectId).customGroups());
        return List.copyOf(groups);
    }

    public List<Memory> getMemoriesByGroup(String group) throws IOException {
        ensureInitialized();
        return getAll().stream().filter(memory -> memory.group().equals(group)).toList();
    }

    public List<Memory> search(MemorySearchOptions options) throws IOException {
        ensureInitialized();
        MemorySearchOptions safe = options == null ? MemorySearchOptions.query(null) : options;
        String query = safe.query() == null ? "" : safe.query().trim().toLowerCase(Locale.ROOT);
        List<MemoryAtom> candidates = query.isEmpty()
            ? atoms.listAllByProject(projectId)
            : atoms.search(projectId, query, Integer.MAX_VALUE);

        List<Memory> results = new ArrayList<>();
        for (MemoryAtom atom : candidates) {
            Memory memory = MemoryMapper.toMemory(atom);
            if (!matches(memory, safe, query)) {
                continue;
            }
            results.add(memory);
            if (safe.limit() != null && safe.limit() > 0 && results.size() >= safe.limit()) {
                break;
            }
        }
        return results;
    }

    public List<Memory> getAll() throws IOException {
        ensureInitialized();
        return atoms.listAllByProject(projectId).stream().map(MemoryMapper::toMemory).toList();
    }

    /**
     * Scores visible memories against free text with the default weights. Storage
     * failures degrade to an empty list.
     */
    public List<ScoredMemory> getRelevantMemories(String context, int limit) {
        ensureInitialized();
        if (context == null || context.isBlank()) {
            return List.of();
        }
        try {
            List<Memory> memories = visibleAtoms(false).stream().map(MemoryMapper::toMemory).toList();
            return scorer.score(memories, context, RetrievalWeights.defaults(), limit);
        } catch (IOException e) {
            LOG.warn("Relevant memory lookup failed for {}: {}", projectId, e.getMessage());
            return List.of();
        }
    }

    public MemoryQueryResult deepQuery(String sessionId, String query, QueryOptions options) {
        ensureInitialized();
        QueryOptions resolved = options == null ? QueryOptions.defaults() : options;
        String safeSession = sessionId == null ? "" : sessionId;
        String safeQuery = query == null ? "" : query;
        String queryId = "mq_" + UUID.randomUUID();
        long createdAt = clock.millis();
        long startedNanos = System.nanoTime();

        try {
            List<MemoryAtom> candidates = visibleAtoms(resolved.includeSensitive());
            Map<String, MemoryAtom> byId = new LinkedHashMap<>();
            List<Memory> memories = new ArrayList<>(candidates.size());
            for (MemoryAtom atom : candidates) {
                byId.put(atom.id(), atom);
                memories.add(MemoryMapper.toMemory(atom));
            }

            List<ScoredMemory> ranked = scorer.score(memories, safeQuery, resolved.effectiveWeights(), resolved.limit());
            List<QueryEvidence> evidence = new ArrayList<>(ranked.size());
            List<MemoryAtom> rankedAtoms = new ArrayList<>(ranked.size());
            for (ScoredMemory scored : ranked) {
                MemoryAtom atom = byId.get(scored.memory().id());
                if (atom == null) {
                    continue;
                }
                rankedAtoms.add(atom);
                evidence.add(new QueryEvidence(atom.id(), scored.relevanceScore(), reasonsFor(scored.memory())));
            }

            MemoryQueryResult result = new MemoryQueryResult(
                queryId,
                safeSession,
                safeQuery,
                resolved,
                evidence,
                rankedAtoms,
                candidates.size(),
                elapsedMillis(startedNanos),
                createdAt
            );
            logQuery(result);
            return result;
        } catch (IOException e) {
            LOG.warn("Deep query {} failed for {}: {}", queryId, projectId, e.getMessage());
            return new MemoryQueryResult(
                queryId, safeSession, safeQuery, resolved, List.of(), List.of(), 0, elapsedMillis(startedNanos), createdAt
            );
        }
    }

    public MemoryFeedback applyFeedback(FeedbackRequest request) throws IOException {
        ensureInitialized();
        Objects.requireNonNull(request, "request must not be null");
        return withProjectLock(() -> feedback.apply(projectId, request));
    }

    public ConsolidationResult consolidateMemory(ConsolidationPolicy policy) throws IOException {
        return consolidateMemory(policy, ConsolidationBudget.unbounded());
    }

    public ConsolidationResult consolidateMemory(ConsolidationPolicy policy, ConsolidationBudget budget)
        throws IOException {
        ensureInitialized();
        return withProjectLock(() -> {
            ConsolidationResult result = consolidation.run(projectId, policy, budget);
            ProjectState state = projectState.load(projectId);
            projectState.save(projectId, state.withLastConsolidationRunAt(result.completedAt()));
            return result;
        });
    }

    /**
     * Runs consolidation when enabled and at least one interval has passed since
     * the last completed run, or unconditionally when forced.
     */
    public Optional<ConsolidationResult> maybeRunPeriodicConsolidation(PeriodicConsolidationOptions options)
        throws IOException {
        ensureInitialized();
        Objects.requireNonNull(options, "options must not be null");
        if (!options.force()) {
            if (!options.enabled()) {
                return Optional.empty();
            }
            long lastRun = projectState.load(projectId).lastConsolidationRunAt();
            if (clock.millis() - lastRun < options.intervalMillis()) {
                LOG.debug("Periodic consolidation for {} not due yet", projectId);
                return Optional.empty();
            }
        }
        return Optional.of(consolidateMemory(options.policy(), options.budget()));
    }

    public List<ConsolidationRun> listConsolidationRuns(int limit) throws IOException {
        ensureInitialized();
        return consolidationRuns.listRecent(projectId, limit);
    }

    /**
     * Records that a session used a memory. Unknown memories are ignored.
     */
    public void addRelatedSession(String memoryId, String sessionId) throws IOException {
        ensureInitialized();
        if (sessionId == null || sessionId.isBlank()) {
            return;
        }
        withProjectLock(() -> {
            Optional<MemoryAtom> found = findOwnAtom(memoryId);
            if (found.isEmpty()) {
                return null;
            }
            Memory memory = MemoryMapper.toMemory(found.get());
            if (memory.relatedSessionIds().contains(sessionId)) {
                return null;
            }
            List<String> sessions = new ArrayList<>(memory.relatedSessionIds());
            sessions.add(sessionId);
            atoms.upsert(MemoryMapper.toAtom(memory.withRelatedSessionIds(sessions, clock.instant()), projectId, found.get()));
            return null;
        });
    }

    /**
     * Markdown block of memories for prompt injection: the most relevant ones
     * when a context is given, otherwise all of them. Empty when there is nothing
     * to show.
     */
    public String buildMemoryPromptSection(String sessionContext) throws IOException {
        ensureInitialized();
        List<ScoredMemory> entries;
        if (sessionContext != null && !sessionContext.isBlank()) {
            entries = getRelevantMemories(sessionContext, DEFAULT_RELEVANT_LIMIT);
        } else {
            entries = getAll().stream().map(memory -> new ScoredMemory(memory, -1)).toList();
        }
        if (entries.isEmpty()) {
            return "";
        }

        StringBuilder section = new StringBuilder()
            .append("## Relevant Memories\n\n")
            .append("The following memories from previous interactions may be relevant:\n\n");
        for (ScoredMemory entry : entries) {
            Memory memory = entry.memory();
            section.append("### ").append(memory.title());
            if (entry.relevanceScore() >= 0) {
                section.append(String.format(Locale.ROOT, " (relevance: %.0f%%)", entry.relevanceScore() * 100));
            }
            section.append('\n')
                .append("*Group: ").append(memory.group())
                .append(" | Tags: ").append(memory.tags().isEmpty() ? "none" : String.join(", ", memory.tags()))
                .append("*\n\n")
                .append(memory.content())
                .append("\n\n");
        }
        return section.toString();
    }

    private Optional<MemoryAtom> findOwnAtom(String id) throws IOException {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return atoms.findById(id).filter(atom -> atom.projectId().equals(projectId));
    }

    private List<MemoryAtom> visibleAtoms(boolean includeSensitive) throws IOException {
        List<MemoryAtom> all = atoms.listAllByProject(projectId);
        if (includeSensitive) {
            return all;
        }
        return all.stream().filter(atom -> atom.sensitivity() == Sensitivity.NORMAL).toList();
    }

    private void registerGroup(String group) throws IOException {
        if (MemoryGroups.isDefault(group)) {
            return;
        }
        ProjectState state = projectState.load(projectId);
        if (!state.customGroups().contains(group)) {
            projectState.save(projectId, state.withGroup(group));
        }
    }

    private void logQuery(MemoryQueryResult result) {
        try {
            queryLog.logQuery(result, projectId);
        } catch (IOException e) {
            LOG.warn("Failed to log memory query {}: {}", result.queryId(), e.getMessage());
        }
    }

    private static boolean matches(Memory memory, MemorySearchOptions options, String query) {
        if (!options.groups().isEmpty() && !options.groups().contains(memory.group())) {
            return false;
        }
        if (options.source() != null && memory.source() != options.source()) {
            return false;
        }
        if (options.minConfidence() != null && memory.confidence() < options.minConfidence()) {
            return false;
        }
        if (!options.tags().isEmpty() && options.tags().stream().noneMatch(memory.tags()::contains)) {
            return false;
        }
        if (query.isEmpty()) {
            return true;
        }
        return memory.title().toLowerCase(Locale.ROOT).contains(query)
            || memory.content().toLowerCase(Locale.ROOT).contains(query)
            || memory.tags().stream().anyMatch(tag -> tag.toLowerCase(Locale.ROOT).contains(query));
    }

    private static List<String> reasonsFor(Memory memory) {
        List<String> reasons = new ArrayList<>();
        reasons.add("group:" + memory.group());
        reasons.add(String.format(Locale.ROOT, "confidence:%.2f", memory.confidence()));
        memory.tags().stream().limit(MAX_EVIDENCE_TAGS).forEach(tag -> reasons.add("tag:" + tag));
        return reasons;
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private <T> T withProjectLock(LockedOperation<T> operation) throws IOException {
        ReentrantLock lock = locks.lockFor(projectId);
        lock.lock();
        try {
            return operation.run();
        } finally {
            lock.unlock();
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("MemoryService not initialized. Call initialize() first.");
        }
    }

    @FunctionalInterface
    private interface LockedOperation<T> {
        T run() throws IOException;
    }
}
