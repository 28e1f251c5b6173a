package max.repertoire.video;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on a background reconciliation. The result future completes normally for a cancelled run
 * that got to build something ({@link ReconciliationResult#cancelled()} is then true), and is itself
 * cancelled when the run was stopped before reconciliation started.
 */
public final class ReconciliationTask {
    private final String id;
    private final AtomicBoolean stopFlag = new AtomicBoolean(false);
    private final CompletableFuture<ReconciliationResult> result = new CompletableFuture<>();
    private volatile ProgressEvent lastEvent = ProgressEvent.of(ProgressStatus.PENDING, 0, "queued");

    ReconciliationTask(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public CompletableFuture<ReconciliationResult> result() {
        return result;
    }

    public ProgressEvent lastEvent() {
        return lastEvent;
    }

    public boolean isDone() {
        return lastEvent.isTerminal();
    }

    void cancel() {
        stopFlag.set(true);
    }

    AtomicBoolean stopFlag() {
        return stopFlag;
    }

    void lastEvent(ProgressEvent event) {
        lastEvent = event;
    }
}
