package io.mnemo.core.store;

import io.mnemo.core.atom.AtomRepository;
import io.mnemo.core.atom.InMemoryAtomRepository;
import io.mnemo.core.atom.SqliteAtomRepository;
import io.mnemo.core.consolidation.ConsolidationRunStore;
import io.mnemo.core.consolidation.InMemoryConsolidationRunStore;
import io.mnemo.core.consolidation.SqliteConsolidationRunStore;
import io.mnemo.core.querylog.InMemoryQueryLogStore;
import io.mnemo.core.querylog.QueryLogStore;
import io.mnemo.core.querylog.SqliteQueryLogStore;
import io.mnemo.core.settings.InMemorySettingsStore;
import io.mnemo.core.settings.SettingsStore;
import io.mnemo.core.settings.SqliteSettingsStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * The storage collaborators the memory engine consumes, built together so they
 * share one backend.
 */
public record MemoryStores(
    AtomRepository atoms,
    SettingsStore settings,
    QueryLogStore queryLog,
    ConsolidationRunStore consolidationRuns
) {
    public static MemoryStores sqlite(Path dbPath, Clock clock) throws IOException {
        SqliteDatabase database = new SqliteDatabase(dbPath);
        return new MemoryStores(
            new SqliteAtomRepository(database),
            new SqliteSettingsStore(database, clock),
            new SqliteQueryLogStore(database),
            new SqliteConsolidationRunStore(database)
        );
    }

    public static MemoryStores inMemory() {
        return new MemoryStores(
            new InMemoryAtomRepository(),
            new InMemorySettingsStore(),
            new InMemoryQueryLogStore(),
            new InMemoryConsolidationRunStore()
        );
    }
}
