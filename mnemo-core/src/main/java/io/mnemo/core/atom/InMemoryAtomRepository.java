package io.mnemo.core.atom;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class InMemoryAtomRepository implements AtomRepository {
    private static final Comparator<MemoryAtom> RECENT_FIRST =
        Comparator.comparingLong(MemoryAtom::updatedAt).reversed().thenComparing(MemoryAtom::id);

    private final Map<String, MemoryAtom> atoms = new LinkedHashMap<>();

    @Override
    public synchronized List<MemoryAtom> listByProject(String projectId, int limit, int offset) {
        return atoms.values().stream()
            .filter(atom -> atom.projectId().equals(projectId))
            .sorted(RECENT_FIRST)
            .skip(Math.max(0, offset))
            .limit(Math.max(1, limit))
            .toList();
    }

    @Override
    public synchronized Optional<MemoryAtom> findById(String id) {
        return Optional.ofNullable(atoms.get(id));
    }

    @Override
    public synchronized void upsert(MemoryAtom atom) {
        atoms.put(atom.id(), atom);
    }

    @Override
    public synchronized boolean delete(String id) {
        return atoms.remove(id) != null;
    }

    @Override
    public synchronized List<MemoryAtom> search(String projectId, String query, int limit) {
        String needle = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        List<MemoryAtom> matches = new ArrayList<>();
        for (MemoryAtom atom : atoms.values()) {
            if (atom.projectId().equals(projectId) && matches(atom, needle)) {
                matches.add(atom);
            }
        }
        return matches.stream()
            .sorted(Comparator.comparing(MemoryAtom::pinned).reversed().thenComparing(RECENT_FIRST))
            .limit(Math.max(1, limit))
            .toList();
    }

    private boolean matches(MemoryAtom atom, String needle) {
        if (atom.content().toLowerCase(Locale.ROOT).contains(needle)) {
            return true;
        }
        if (atom.summary() != null && atom.summary().toLowerCase(Locale.ROOT).contains(needle)) {
            return true;
        }
        return atom.keywords().stream().anyMatch(keyword -> keyword.toLowerCase(Locale.ROOT).contains(needle));
    }
}
