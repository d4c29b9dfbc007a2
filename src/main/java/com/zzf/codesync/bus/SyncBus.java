package com.zzf.codesync.bus;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Typed publish/subscribe for sync notifications.
 *
 * <p>Each channel delivers on its own lane, so events of one channel reach subscribers in publish order
 * while the publisher returns immediately. A subscriber that throws is logged and skipped; the remaining
 * subscribers still get the event.
 */
@Slf4j
@Component
public class SyncBus {

    private final Map<String, List<Consumer<Object>>> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, Executor> lanes = new ConcurrentHashMap<>();
    private final List<ExecutorService> owned = Collections.synchronizedList(new ArrayList<>());
    private final Executor sharedExecutor;

    public SyncBus() {
        this.sharedExecutor = null;
    }

    /**
     * Delivers every channel on {@code executor}; {@code Runnable::run} delivers on the publishing thread.
     */
    public SyncBus(Executor executor) {
        this.sharedExecutor = executor;
    }

    public static final class Channel<T> {
        private final String name;
        private final Class<T> payloadType;

        private Channel(String name, Class<T> payloadType) {
            this.name = name;
            this.payloadType = payloadType;
        }

        public static <T> Channel<T> of(String name, Class<T> payloadType) {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException("channel name is blank");
            }
            return new Channel<>(name.trim(), payloadType);
        }

        public String getName() {
            return name;
        }

        void requireType(Object payload) {
            if (payload != null && !payloadType.isInstance(payload)) {
                throw new IllegalArgumentException("channel " + name + " carries " + payloadType.getSimpleName()
                        + ", got " + payload.getClass().getSimpleName());
            }
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Queues {@code payload} for every current subscriber of {@code channel}. The returned future completes
     * once all of them ran; it fails with the first subscriber error, later ones attached as suppressed.
     * A payload that is not of the channel's type is refused before anything is queued.
     */
    public <T> CompletableFuture<Void> publish(Channel<T> channel, T payload) {
        channel.requireType(payload);
        List<Consumer<Object>> subs = subscriptions.getOrDefault(channel.getName(), Collections.emptyList());
        List<Consumer<Object>> snapshot;
        synchronized (subs) {
            snapshot = new ArrayList<>(subs);
        }
        if (snapshot.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            laneFor(channel.getName()).execute(() -> deliver(channel, payload, snapshot, done));
        } catch (RejectedExecutionException e) {
            log.debug("bus.publish.rejected channel={} err={}", channel, e.toString());
            done.completeExceptionally(e);
        }
        return done;
    }

    @SuppressWarnings("unchecked")
    public <T> Runnable subscribe(Channel<T> channel, Consumer<? super T> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback is null");
        }
        Consumer<Object> subscription = payload -> callback.accept((T) payload);
        subscriptions.computeIfAbsent(channel.getName(), k -> Collections.synchronizedList(new ArrayList<>()))
                .add(subscription);
        return () -> unsubscribe(channel.getName(), subscription);
    }

    public int subscriberCount(Channel<?> channel) {
        return subscriptions.getOrDefault(channel.getName(), Collections.emptyList()).size();
    }

    private void unsubscribe(String channel, Consumer<Object> subscription) {
        List<Consumer<Object>> subs = subscriptions.get(channel);
        if (subs != null) {
            subs.remove(subscription);
        }
    }

    private <T> void deliver(Channel<T> channel, T payload, List<Consumer<Object>> subs, CompletableFuture<Void> done) {
        Throwable firstError = null;
        for (Consumer<Object> sub : subs) {
            try {
                sub.accept(payload);
            } catch (Throwable t) {
                log.warn("bus.subscriber.failed channel={} err={}", channel, t.toString());
                if (firstError == null) {
                    firstError = t;
                } else {
                    firstError.addSuppressed(t);
                }
            }
        }
        if (firstError != null) {
            done.completeExceptionally(firstError);
        } else {
            done.complete(null);
        }
    }

    private Executor laneFor(String channel) {
        if (sharedExecutor != null) {
            return sharedExecutor;
        }
        return lanes.computeIfAbsent(channel, name -> {
            ExecutorService lane = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "sync-bus-" + name);
                t.setDaemon(true);
                return t;
            });
            owned.add(lane);
            return lane;
        });
    }

    @PreDestroy
    public void shutdown() {
        synchronized (owned) {
            for (ExecutorService lane : owned) {
                lane.shutdown();
            }
        }
    }
}
