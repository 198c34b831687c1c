package io.github.samzhu.podledger.feed;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import io.github.samzhu.podledger.dto.ChangeKind;
import io.github.samzhu.podledger.dto.PodEvent;
import io.github.samzhu.podledger.exception.FeedPositionExpiredException;
import io.github.samzhu.podledger.exception.FeedTransportException;

/**
 * 將 fabric8 {@link Watcher} 回呼轉為阻塞式、有時限的 {@link PodSubscription}。
 *
 * <p>fabric8 的 watch 執行緒只負責把事件放入佇列；控制執行緒透過
 * {@link #hasNext()} / {@link #next()} 依序取出並處理，一次一個。
 * 到達時限、watch 關閉或 {@link #close()} 後序列結束。
 */
class PodWatchQueue implements Watcher<Pod>, PodSubscription {

    private static final Logger log = LoggerFactory.getLogger(PodWatchQueue.class);

    private static final Signal END = new Signal(null, null);

    private final BlockingQueue<Signal> queue = new LinkedBlockingQueue<>();
    private final PodMapper mapper;
    private final String fromResourceVersion;
    private final long deadlineNanos;

    private volatile Watch watch;
    private volatile boolean closed;
    private PodEvent pending;
    private boolean finished;

    PodWatchQueue(PodMapper mapper, String fromResourceVersion, Duration timeout) {
        this.mapper = mapper;
        this.fromResourceVersion = fromResourceVersion;
        this.deadlineNanos = System.nanoTime() + timeout.toNanos();
    }

    void attach(Watch watch) {
        this.watch = watch;
        if (closed) {
            watch.close();
        }
    }

    // ===== Watcher =====

    @Override
    public void eventReceived(Action action, Pod pod) {
        if (closed) {
            return;
        }
        if (action == Action.ERROR) {
            queue.offer(Signal.failure(new FeedTransportException("Watch delivered an ERROR event")));
            return;
        }
        if (pod == null || pod.getMetadata() == null) {
            return;
        }

        String resourceVersion = pod.getMetadata().getResourceVersion();
        if (action == Action.BOOKMARK) {
            queue.offer(Signal.event(PodEvent.bookmark(resourceVersion)));
            return;
        }

        try {
            ChangeKind kind = action == Action.DELETED ? ChangeKind.REMOVED : ChangeKind.CREATED_OR_UPDATED;
            queue.offer(Signal.event(new PodEvent(kind, mapper.toInstance(pod), resourceVersion)));
        } catch (RuntimeException e) {
            log.error("Failed to map pod event: action={}, pod={}/{}: {}", action,
                pod.getMetadata().getNamespace(), pod.getMetadata().getName(), e.getMessage(), e);
        }
    }

    @Override
    public void onClose(WatcherException cause) {
        if (cause.isHttpGone()) {
            queue.offer(Signal.failure(new FeedPositionExpiredException(fromResourceVersion, cause)));
        } else {
            queue.offer(Signal.failure(new FeedTransportException("Watch closed with error", cause)));
        }
    }

    @Override
    public void onClose() {
        queue.offer(END);
    }

    // ===== PodSubscription =====

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished) {
            return false;
        }

        long remaining = deadlineNanos - System.nanoTime();
        Signal signal;
        try {
            signal = remaining > 0 ? queue.poll(remaining, TimeUnit.NANOSECONDS) : queue.poll();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            signal = END;
        }

        if (signal == null || signal == END || closed) {
            finish();
            return false;
        }
        if (signal.failure() != null) {
            finish();
            throw signal.failure();
        }
        pending = signal.event();
        return true;
    }

    @Override
    public PodEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        PodEvent event = pending;
        pending = null;
        return event;
    }

    @Override
    public void close() {
        closed = true;
        Watch current = watch;
        if (current != null) {
            current.close();
        }
        queue.offer(END);
    }

    private void finish() {
        finished = true;
        Watch current = watch;
        if (current != null) {
            current.close();
        }
    }

    private record Signal(PodEvent event, RuntimeException failure) {

        static Signal event(PodEvent event) {
            return new Signal(event, null);
        }

        static Signal failure(RuntimeException failure) {
            return new Signal(null, failure);
        }
    }
}
