package io.mnemo.core.memory;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.atom.AtomRepository;
import io.mnemo.core.atom.AtomType;
import io.mnemo.core.atom.InMemoryAtomRepository;
import io.mnemo.core.atom.MemoryAtom;
import io.mnemo.core.atom.Provenance;
import io.mnemo.core.atom.ProvenanceSource;
import io.mnemo.core.atom.Sensitivity;
import io.mnemo.core.consolidation.ConsolidationPolicy;
import io.mnemo.core.consolidation.ConsolidationResult;
import io.mnemo.core.consolidation.InMemoryConsolidationRunStore;
import io.mnemo.core.querylog.InMemoryQueryLogStore;
import io.mnemo.core.retrieval.TermMatchLexicalRanker;
import io.mnemo.core.settings.InMemorySettingsStore;
import io.mnemo.core.store.MemoryStores;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MemoryServiceConcurrencyTest {
    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldKeepMergedDuplicateDeletedWhenReadRacesConsolidation() throws Exception {
        PausingAtomRepository atoms = new PausingAtomRepository();
        MemoryStores stores = new MemoryStores(
            atoms, new InMemorySettingsStore(), new InMemoryQueryLogStore(), new InMemoryConsolidationRunStore()
        );
        MemoryService service = new MemoryService(tempDir, stores, CLOCK);
        service.initialize();
        atoms.upsert(atom("b-keep", service.getProjectId(), "Deploy with the blue green script.", 0.9));
        atoms.upsert(atom("b-dup", service.getProjectId(), "Deploy with the blue green script.", 0.5));

        CountDownLatch consolidated = new CountDownLatch(1);
        List<Future<ConsolidationResult>> runs = new ArrayList<>();
        atoms.pauseOn("b-dup", () -> {
            runs.add(executor.submit(() -> {
                try {
                    return service.consolidateMemory(ConsolidationPolicy.defaults());
                } finally {
                    consolidated.countDown();
                }
            }));
            consolidated.await(300, TimeUnit.MILLISECONDS);
        });

        Optional<Memory> read = service.read("b-dup");
        ConsolidationResult result = runs.get(0).get(5, TimeUnit.SECONDS);

        assertThat(read).isPresent();
        assertThat(result.mergedCount()).isEqualTo(1);
        assertThat(atoms.listAllByProject(service.getProjectId())).extracting(MemoryAtom::id).containsExactly("b-keep");
        assertThat(service.read("b-dup")).isEmpty();
    }

    @Test
    void shouldFoldConcurrentIdenticalCreatesIntoOneMemory() throws Exception {
        MemoryStores stores = MemoryStores.inMemory();
        ProjectLocks locks = new ProjectLocks();
        MemoryService first = new MemoryService(tempDir, stores, locks, CLOCK, new TermMatchLexicalRanker());
        MemoryService second = new MemoryService(tempDir, stores, locks, CLOCK, new TermMatchLexicalRanker());
        first.initialize();
        second.initialize();

        CountDownLatch start = new CountDownLatch(1);
        List<Future<Memory>> creates = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            MemoryService target = i % 2 == 0 ? first : second;
            creates.add(executor.submit(() -> {
                start.await();
                return target.create(new CreateMemoryInput(
                    "Lint", "Run the linter before every push.", null, List.of("ci"), MemorySource.MANUAL
                ));
            }));
        }
        start.countDown();

        Set<String> ids = new HashSet<>();
        for (Future<Memory> create : creates) {
            ids.add(create.get(5, TimeUnit.SECONDS).id());
        }

        assertThat(ids).hasSize(1);
        assertThat(first.getAll()).extracting(Memory::id).containsExactlyElementsOf(ids);
    }

    @Test
    void shouldNotLoseCreatesRunningAlongsideConsolidation() throws Exception {
        MemoryStores stores = MemoryStores.inMemory();
        MemoryService service = new MemoryService(tempDir, stores, CLOCK);
        service.initialize();
        stores.atoms().upsert(atom("seed-1", service.getProjectId(), "Cache keys include the schema version.", 0.9));
        stores.atoms().upsert(atom("seed-2", service.getProjectId(), "Cache keys include the schema version.", 0.6));

        CountDownLatch start = new CountDownLatch(1);
        List<Future<Memory>> creates = new ArrayList<>();
        List<Future<ConsolidationResult>> runs = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            String content = String.format(Locale.ROOT, "Service%d reads settings from module%d", i, i);
            creates.add(executor.submit(() -> {
                start.await();
                return service.create(new CreateMemoryInput("Settings", content, null, null, MemorySource.MANUAL));
            }));
        }
        for (int i = 0; i < 6; i++) {
            creates.add(executor.submit(() -> {
                start.await();
                return service.create(new CreateMemoryInput(
                    "Merging", "Always squash commits before merging.", null, null, MemorySource.MANUAL
                ));
            }));
        }
        for (int i = 0; i < 4; i++) {
            runs.add(executor.submit(() -> {
                start.await();
                return service.consolidateMemory(ConsolidationPolicy.defaults());
            }));
        }
        start.countDown();

        Set<String> createdIds = new HashSet<>();
        for (Future<Memory> create : creates) {
            createdIds.add(create.get(5, TimeUnit.SECONDS).id());
        }
        int merged = 0;
        for (Future<ConsolidationResult> run : runs) {
            merged += run.get(5, TimeUnit.SECONDS).mergedCount();
        }

        List<Memory> all = service.getAll();
        assertThat(merged).isEqualTo(1);
        assertThat(createdIds).hasSize(13);
        assertThat(all).hasSize(14);
        assertThat(all).extracting(Memory::id).containsAll(createdIds);
        assertThat(all).extracting(Memory::content).doesNotHaveDuplicates();
    }

    private static MemoryAtom atom(String id, String projectId, String content, double confidence) {
        long now = NOW.toEpochMilli();
        return new MemoryAtom(
            id, projectId, null, null, AtomType.SEMANTIC, content, null, List.of(),
            Provenance.of(ProvenanceSource.USER), confidence, Sensitivity.NORMAL, false, now, now, null
        );
    }

    @FunctionalInterface
    private interface Pause {
        void run() throws InterruptedException;
    }

    private static final class PausingAtomRepository implements AtomRepository {
        private final InMemoryAtomRepository delegate = new InMemoryAtomRepository();
        private volatile String pauseId;
        private volatile Pause pause;

        void pauseOn(String id, Pause action) {
            this.pauseId = id;
            this.pause = action;
        }

        @Override
        public List<MemoryAtom> listByProject(String projectId, int limit, int offset) {
            return delegate.listByProject(projectId, limit, offset);
        }

        @Override
        public Optional<MemoryAtom> findById(String id) throws IOException {
            Optional<MemoryAtom> found = delegate.findById(id);
            Pause action = pause;
            if (action != null && id.equals(pauseId)) {
                pause = null;
                try {
                    action.run();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted while paused on " + id, e);
                }
            }
            return found;
        }

        @Override
        public void upsert(MemoryAtom atom) {
            delegate.upsert(atom);
        }

        @Override
        public boolean delete(String id) {
            return delegate.delete(id);
        }

        @Override
        public List<MemoryAtom> search(String projectId, String query, int limit) {
            return delegate.search(projectId, query, limit);
        }
    }
}
