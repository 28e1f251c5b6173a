package max.repertoire.service;

import max.repertoire.tree.RepertoireTree;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of repertoires, by id. Implementations hand out and keep independent copies:
 * a tree returned by {@link #load} can be mutated freely until it is saved.
 */
public interface RepertoireStore {

    Optional<RepertoireTree> load(String id);

    void save(String owner, RepertoireTree tree);

    boolean delete(String id);

    List<RepertoireTree> listByOwner(String owner);

    int countByOwner(String owner);

    Optional<String> ownerOf(String id);
}
