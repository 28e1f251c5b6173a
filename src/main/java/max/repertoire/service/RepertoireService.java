package max.repertoire.service;

import max.repertoire.analysis.GameAnalysis;
import max.repertoire.analysis.GameMatchAnalyzer;
import max.repertoire.analysis.ParsedGame;
import max.repertoire.analysis.RepertoireMatch;
import max.repertoire.common.Color;
import max.repertoire.tree.ErrorKind;
import max.repertoire.tree.MergeResult;
import max.repertoire.tree.RepertoireException;
import max.repertoire.tree.RepertoireTree;
import max.repertoire.tree.TreeMutator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Entry point for repertoire operations. Every mutation of a tree runs under that tree's lock, on a
 * working copy that is only saved when the operation succeeds. Reads return snapshots.
 */
public class RepertoireService {
    private static final Logger log = LoggerFactory.getLogger(RepertoireService.class);

    private final RepertoireStore store;
    private final TreeMutator mutator;
    private final GameMatchAnalyzer analyzer;
    private final RepertoireConfig config;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public RepertoireService(RepertoireStore store, TreeMutator mutator, GameMatchAnalyzer analyzer, RepertoireConfig config) {
        this.store = Objects.requireNonNull(store);
        this.mutator = Objects.requireNonNull(mutator);
        this.analyzer = Objects.requireNonNull(analyzer);
        this.config = Objects.requireNonNull(config);
    }

    public RepertoireTree create(String owner, String name, Color color) {
        String validName = validateName(name);
        return withLock(ownerKey(owner), () -> {
            checkLimit(owner);
            RepertoireTree tree = RepertoireTree.newRepertoire(validName, color, mutator.rules().startingPosition());
            store.save(owner, tree);
            log.info("Created {} repertoire {} for {}", color, tree.id(), owner);
            return tree.copy();
        });
    }

    public RepertoireTree get(String id) {
        return withLock(id, () -> load(id));
    }

    public List<RepertoireTree> list(String owner) {
        return store.listByOwner(owner);
    }

    public RepertoireTree rename(String id, String name) {
        String validName = validateName(name);
        return mutate(id, tree -> mutator.rename(tree, validName));
    }

    public void delete(String id) {
        withLock(id, () -> {
            if(!store.delete(id)) {
                throw notFound(id);
            }
            // removed while held: a thread waiting on it finds the tree gone
            locks.remove(id);
            log.info("Deleted repertoire {}", id);
            return null;
        });
    }

    public RepertoireTree addNode(String id, long parentId, String move) {
        return mutate(id, tree -> mutator.addNode(tree, parentId, move));
    }

    /** Adds a whole line, reusing the moves already there. Used to adopt new opponent lines. */
    public RepertoireTree addLine(String id, long fromNodeId, List<String> moves) {
        return mutate(id, tree -> mutator.addLine(tree, fromNodeId, moves));
    }

    public RepertoireTree deleteNode(String id, long nodeId) {
        return mutate(id, tree -> mutator.deleteNode(tree, nodeId));
    }

    public RepertoireTree updateComment(String id, long nodeId, String comment) {
        return mutate(id, tree -> mutator.updateComment(tree, nodeId, comment));
    }

    public RepertoireTree extract(String id, long nodeId, String newName) {
        String validName = validateName(newName);
        String owner = store.ownerOf(id).orElseThrow(() -> notFound(id));
        RepertoireTree source = get(id);
        return withLock(ownerKey(owner), () -> {
            checkLimit(owner);
            RepertoireTree extracted = mutator.extractSubtree(source, nodeId, validName);
            store.save(owner, extracted);
            return extracted.copy();
        });
    }

    /**
     * Merges the repertoires into a new one owned by the owner of the first, then deletes them.
     */
    public MergeResult merge(List<String> ids, String newName) {
        String validName = validateName(newName);
        if(ids == null || ids.size() < 2) {
            throw new RepertoireException(ErrorKind.MERGE_MINIMUM_TWO, "at least two repertoires are required to merge");
        }
        return withLocks(ids, () -> {
            List<RepertoireTree> sources = new ArrayList<>(ids.size());
            for(String id : ids) {
                sources.add(load(id));
            }
            String owner = store.ownerOf(ids.get(0)).orElseThrow(() -> notFound(ids.get(0)));
            MergeResult result = mutator.mergeRepertoires(sources, validName);
            store.save(owner, result.merged());
            for(String id : ids) {
                store.delete(id);
                locks.remove(id);
            }
            log.info("Merged {} into {}", ids, result.merged().id());
            return new MergeResult(result.merged().copy(), result.annotationConflicts());
        });
    }

    public GameAnalysis analyzeGame(String id, ParsedGame game) {
        return analyzer.analyzeGame(get(id), game);
    }

    /**
     * Finds the owner's repertoire covering most of {@code username}'s moves in the game and analyzes
     * the game against it. Empty when the user did not play the game or owns no repertoire of that color.
     */
    public Optional<MatchedGame> matchGame(String owner, String username, ParsedGame game) {
        Optional<Color> userColor = game.userColor(username);
        if(userColor.isEmpty()) {
            log.debug("{} did not play {} - {}", username, game.header("White"), game.header("Black"));
            return Optional.empty();
        }
        Optional<RepertoireMatch> match = analyzer.findBestMatchingRepertoire(store.listByOwner(owner), game, userColor.get());
        return match.map(m -> new MatchedGame(game, userColor.get(), m.repertoire().id(), m.repertoire().name(),
                m.score(), analyzer.analyzeGame(m.repertoire(), game)));
    }

    /** Grafts a reconciled fragment onto the repertoire. @return the number of positions added */
    public int graftFragment(String id, RepertoireTree fragment) {
        int[] created = new int[1];
        mutate(id, tree -> created[0] = mutator.graft(tree, fragment));
        return created[0];
    }

    int lockCount() {
        return locks.size();
    }

    private RepertoireTree mutate(String id, Consumer<RepertoireTree> mutation) {
        return withLock(id, () -> {
            RepertoireTree tree = load(id);
            mutation.accept(tree);
            String owner = store.ownerOf(id).orElseThrow(() -> notFound(id));
            store.save(owner, tree);
            return tree.copy();
        });
    }

    private RepertoireTree load(String id) {
        return store.load(id).orElseThrow(() -> notFound(id));
    }

    private void checkLimit(String owner) {
        int count = store.countByOwner(owner);
        if(count >= config.maxPerOwner) {
            throw new RepertoireException(ErrorKind.LIMIT_REACHED,
                    "limit of "+config.maxPerOwner+" repertoires reached for "+owner);
        }
    }

    private String validateName(String name) {
        String trimmed = name == null ? "" : name.trim();
        if(trimmed.isEmpty()) {
            throw new RepertoireException(ErrorKind.NAME_REQUIRED, "name is required");
        }
        if(trimmed.length() > config.maxNameLength) {
            throw new RepertoireException(ErrorKind.NAME_TOO_LONG,
                    "name must be "+config.maxNameLength+" characters or less");
        }
        return trimmed;
    }

    private static RepertoireException notFound(String id) {
        return new RepertoireException(ErrorKind.REPERTOIRE_NOT_FOUND, "repertoire not found: "+id);
    }

    private static String ownerKey(String owner) {
        return "owner:" + owner;
    }

    private <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    // Sorted acquisition: two merges over the same trees cannot deadlock
    private <T> T withLocks(Collection<String> keys, Supplier<T> action) {
        List<ReentrantLock> acquired = new ArrayList<>();
        try {
            for(String key : new TreeSet<>(keys)) {
                ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
                lock.lock();
                acquired.add(lock);
            }
            return action.get();
        } finally {
            for(int i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).unlock();
            }
        }
    }
}
