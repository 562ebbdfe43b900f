package io.mnemo.core.atom;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public interface AtomRepository {
    int PAGE_SIZE = 500;

    List<MemoryAtom> listByProject(String projectId, int limit, int offset) throws IOException;

    Optional<MemoryAtom> findById(String id) throws IOException;

    void upsert(MemoryAtom atom) throws IOException;

    boolean delete(String id) throws IOException;

    /**
     * Case-insensitive substring match on content, summary or keywords, pinned
     * atoms first, then most recently updated.
     */
    List<MemoryAtom> search(String projectId, String query, int limit) throws IOException;

    default List<MemoryAtom> listAllByProject(String projectId) throws IOException {
        List<MemoryAtom> all = new ArrayList<>();
        int offset = 0;
        while (true) {
            List<MemoryAtom> page = listByProject(projectId, PAGE_SIZE, offset);
            all.addAll(page);
            if (page.size() < PAGE_SIZE) {
                return all;
            }
            offset += page.size();
        }
    }
}
