package max.repertoire.service;

import max.repertoire.tree.RepertoireTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRepertoireStore implements RepertoireStore {
    private record Entry(String owner, RepertoireTree tree, long savedAt) {}

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<RepertoireTree> load(String id) {
        Entry entry = entries.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.tree().copy());
    }

    @Override
    public void save(String owner, RepertoireTree tree) {
        // the first save fixes the creation order used by listings
        entries.compute(tree.id(), (id, previous) -> new Entry(owner, tree.copy(),
                previous == null ? System.nanoTime() : previous.savedAt()));
    }

    @Override
    public boolean delete(String id) {
        return entries.remove(id) != null;
    }

    @Override
    public List<RepertoireTree> listByOwner(String owner) {
        List<Entry> owned = new ArrayList<>();
        for(Entry entry : entries.values()) {
            if(entry.owner().equals(owner)) {
                owned.add(entry);
            }
        }
        owned.sort(Comparator.comparingLong(Entry::savedAt));
        List<RepertoireTree> trees = new ArrayList<>(owned.size());
        for(Entry entry : owned) {
            trees.add(entry.tree().copy());
        }
        return trees;
    }

    @Override
    public int countByOwner(String owner) {
        int count = 0;
        for(Entry entry : entries.values()) {
            if(entry.owner().equals(owner)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public Optional<String> ownerOf(String id) {
        Entry entry = entries.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.owner());
    }
}
