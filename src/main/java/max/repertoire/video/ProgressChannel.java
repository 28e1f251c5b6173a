package max.repertoire.video;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Progress of one reconciliation task. One producer publishes, at most one consumer is attached at a
 * time and only the attached consumer may poll. Publishing never blocks: when the buffer is full the oldest update is dropped, and one slot is
 * always left for the terminal event.
 */
public final class ProgressChannel {
    private final String taskId;
    private final ArrayBlockingQueue<ProgressEvent> buffer;
    private final AtomicBoolean attached = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile ProgressEvent lastEvent;

    public ProgressChannel(String taskId, int capacity) {
        this.taskId = taskId;
        this.buffer = new ArrayBlockingQueue<>(capacity);
        this.lastEvent = ProgressEvent.of(ProgressStatus.PENDING, 0, "queued");
    }

    public String taskId() {
        return taskId;
    }

    /** @return false once the channel is closed: nothing published after the terminal event is kept */
    public boolean publish(ProgressEvent event) {
        if(closed.get()) {
            return false;
        }
        lastEvent = event;
        if(event.isTerminal()) {
            while(!buffer.offer(event)) {
                buffer.poll();
            }
            closed.set(true);
            return true;
        }
        if(buffer.remainingCapacity() <= 1) {
            buffer.poll();
        }
        return buffer.offer(event);
    }

    /** @return false if another consumer is already attached */
    public boolean attach() {
        return attached.compareAndSet(false, true);
    }

    public void detach() {
        attached.set(false);
    }

    public boolean isAttached() {
        return attached.get();
    }

    /** @throws IllegalStateException if no consumer is attached */
    public Optional<ProgressEvent> poll(long timeout, TimeUnit unit) throws InterruptedException {
        if(!attached.get()) {
            throw new IllegalStateException("no consumer attached to progress of "+taskId);
        }
        return Optional.ofNullable(buffer.poll(timeout, unit));
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Closed and everything published has been consumed. */
    public boolean isDrained() {
        return closed.get() && buffer.isEmpty();
    }

    public ProgressEvent lastEvent() {
        return lastEvent;
    }

    public int buffered() {
        return buffer.size();
    }
}
