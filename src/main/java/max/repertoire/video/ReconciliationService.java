package max.repertoire.video;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs reconciliations in the background. Each task gets its own progress channel, registered while
 * the task runs and deregistered as soon as it reaches a terminal status. Tasks share no mutable state.
 * <p>
 * Finished tasks stay queryable until {@link #forget(String)} or until more than {@code retainedTasks}
 * tasks have finished after them.
 */
public class ReconciliationService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    @FunctionalInterface
    private interface SampleSource {
        List<VideoSample> load(ReconciliationTask task, ProgressChannel channel) throws IOException;
    }

    private final VideoPositionReconciler reconciler;
    private final ExecutorService executor;
    private final Map<String, ReconciliationTask> tasks = new ConcurrentHashMap<>();
    private final Map<String, ProgressChannel> channels = new ConcurrentHashMap<>();
    private final Queue<String> finished = new ConcurrentLinkedQueue<>();
    private final int retainedTasks;

    public ReconciliationService(VideoPositionReconciler reconciler) {
        this(reconciler, Integer.parseInt(System.getProperty("reconciler.threads", "2")),
                Integer.parseInt(System.getProperty("reconciler.retainedTasks", "100")));
    }

    public ReconciliationService(VideoPositionReconciler reconciler, int threads, int retainedTasks) {
        if(retainedTasks < 0) {
            throw new IllegalArgumentException("retainedTasks must be >= 0");
        }
        this.reconciler = Objects.requireNonNull(reconciler);
        this.retainedTasks = retainedTasks;
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "reconciler-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public ReconciliationTask submit(List<VideoSample> samples) {
        List<VideoSample> snapshot = List.copyOf(samples);
        return start((task, channel) -> snapshot);
    }

    public ReconciliationTask submit(FrameRecognizer recognizer, String source) {
        Objects.requireNonNull(recognizer);
        return start((task, channel) -> {
            publish(task, channel, ProgressEvent.of(ProgressStatus.RECOGNIZING, 0, "recognizing "+source));
            return recognizer.recognize(source, task.stopFlag());
        });
    }

    private ReconciliationTask start(SampleSource source) {
        ReconciliationTask task = new ReconciliationTask(UUID.randomUUID().toString());
        ProgressChannel channel = new ProgressChannel(task.id(), reconciler.config().progressBufferCapacity);
        tasks.put(task.id(), task);
        channels.put(task.id(), channel);
        log.info("Reconciliation {} submitted", task.id());
        executor.execute(() -> run(task, channel, source));
        return task;
    }

    private void run(ReconciliationTask task, ProgressChannel channel, SampleSource source) {
        try {
            List<VideoSample> samples = source.load(task, channel);
            if(task.stopFlag().get()) {
                publish(task, channel, ProgressEvent.of(ProgressStatus.CANCELLED, 0, "cancelled before reconciliation"));
                task.result().cancel(false);
                return;
            }
            ReconciliationResult result = reconciler.reconcile(samples, task.stopFlag(), event -> publish(task, channel, event));
            if(result.cancelled()) {
                publish(task, channel, ProgressEvent.of(ProgressStatus.CANCELLED, task.lastEvent().percentComplete(), "cancelled"));
            } else {
                publish(task, channel, ProgressEvent.of(ProgressStatus.COMPLETED, 100,
                        result.fragment().metadata().totalNodes()+" positions, "+result.unlinkedGaps().size()+" gaps"));
            }
            task.result().complete(result);
        } catch (IOException e) {
            fail(task, channel, new UncheckedIOException(e));
        } catch (RuntimeException e) {
            fail(task, channel, e);
        }
    }

    private void fail(ReconciliationTask task, ProgressChannel channel, RuntimeException e) {
        log.warn("Reconciliation {} failed: {}", task.id(), e.getMessage(), e);
        publish(task, channel, ProgressEvent.of(ProgressStatus.FAILED, task.lastEvent().percentComplete(), e.getMessage()));
        task.result().completeExceptionally(e);
    }

    private void publish(ReconciliationTask task, ProgressChannel channel, ProgressEvent event) {
        task.lastEvent(event);
        channel.publish(event);
        if(event.isTerminal()) {
            channels.remove(task.id());
            log.info("Reconciliation {} {}: {}", task.id(), event.status(), event.message());
            retire(task.id());
        }
    }

    private void retire(String taskId) {
        finished.add(taskId);
        while(finished.size() > retainedTasks) {
            String evicted = finished.poll();
            if(evicted != null && tasks.remove(evicted) != null) {
                log.debug("Reconciliation {} evicted", evicted);
            }
        }
    }

    /** @return false if the task is unknown or already finished */
    public boolean cancel(String taskId) {
        ReconciliationTask task = tasks.get(taskId);
        if(task == null || task.isDone()) {
            return false;
        }
        task.cancel();
        log.info("Reconciliation {} cancellation requested", taskId);
        return true;
    }

    /** The live progress channel, empty once the task reached a terminal status. */
    public Optional<ProgressChannel> progress(String taskId) {
        return Optional.ofNullable(channels.get(taskId));
    }

    public Optional<ReconciliationTask> task(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /** Answers polling whether or not the channel is still registered. */
    public Optional<ProgressEvent> lastEvent(String taskId) {
        return task(taskId).map(ReconciliationTask::lastEvent);
    }

    /** Drops a finished task. */
    public boolean forget(String taskId) {
        ReconciliationTask task = tasks.get(taskId);
        if(task != null && task.isDone() && tasks.remove(taskId, task)) {
            finished.remove(taskId);
            return true;
        }
        return false;
    }

    public int retainedTasks() {
        return tasks.size();
    }

    public int activeChannels() {
        return channels.size();
    }

    @Override
    public void close() {
        tasks.values().forEach(ReconciliationTask::cancel);
        executor.shutdown();
        try {
            if(!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
