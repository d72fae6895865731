package com.gnovoa.livematch.broadcast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process fan-out of match notifications keyed by match id.
 *
 * <p>Delivery is best effort and there is no replay buffer: a viewer that subscribes late pulls a
 * snapshot first. Each subscriber owns a bounded queue drained on the delivery executor, one
 * notification at a time and in broadcast order, so {@link #broadcast} only enqueues and never
 * waits on a subscriber. A subscriber that fails or lets its queue overflow is logged and removed.
 */
public final class BroadcastHub {

    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    private final ConcurrentHashMap<String, Set<Channel>> channels = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Executor executor;
    private final int queueCapacity;

    public BroadcastHub(Clock clock, Executor executor, int queueCapacity) {
        if (queueCapacity <= 0) throw new IllegalArgumentException("queueCapacity must be positive");
        this.clock = clock;
        this.executor = executor;
        this.queueCapacity = queueCapacity;
    }

    public Subscription subscribe(String matchId, MatchSubscriber subscriber) {
        Channel channel = new Channel(matchId, subscriber, new ArrayBlockingQueue<>(queueCapacity));
        channels.computeIfAbsent(matchId, k -> ConcurrentHashMap.newKeySet()).add(channel);
        log.debug("Subscriber added to match {} ({} total)", matchId, subscriberCount(matchId));
        return new Subscription(this, matchId, subscriber);
    }

    void unsubscribe(String matchId, MatchSubscriber subscriber) {
        channels.computeIfPresent(matchId, (k, set) -> {
            set.removeIf(c -> c.subscriber == subscriber);
            return set.isEmpty() ? null : set;
        });
    }

    private void drop(Channel channel) {
        channels.computeIfPresent(channel.matchId, (k, set) -> {
            set.remove(channel);
            return set.isEmpty() ? null : set;
        });
        channel.queue.clear();
    }

    public int subscriberCount(String matchId) {
        return channels.getOrDefault(matchId, Set.of()).size();
    }

    public void broadcast(String matchId, NotificationType type, Object payload) {
        Set<Channel> targets = channels.get(matchId);
        if (targets == null || targets.isEmpty()) return;
        MatchNotification n = new MatchNotification(matchId, type, clock.instant(), payload);
        for (Channel c : targets) {
            if (!c.queue.offer(n)) {
                log.warn("Dropping subscriber of match {}: {} pending notifications", matchId, queueCapacity);
                drop(c);
                continue;
            }
            schedule(c);
        }
    }

    private void schedule(Channel c) {
        if (!c.draining.compareAndSet(false, true)) return;
        try {
            executor.execute(() -> drain(c));
        } catch (RejectedExecutionException e) {
            c.draining.set(false);
            log.warn("Dropping subscriber of match {}: delivery executor rejected it", c.matchId, e);
            drop(c);
        }
    }

    private void drain(Channel c) {
        try {
            MatchNotification n;
            while ((n = c.queue.poll()) != null) {
                try {
                    c.subscriber.deliver(n);
                } catch (Exception e) {
                    log.warn("Dropping subscriber of match {} after failed {} delivery",
                            c.matchId, n.type().wireName(), e);
                    drop(c);
                    return;
                }
            }
        } finally {
            c.draining.set(false);
        }
        // a broadcast may have enqueued after the last poll but before the flag was cleared
        if (!c.queue.isEmpty()) schedule(c);
    }

    private static final class Channel {
        private final String matchId;
        private final MatchSubscriber subscriber;
        private final Queue<MatchNotification> queue;
        private final AtomicBoolean draining = new AtomicBoolean();

        private Channel(String matchId, MatchSubscriber subscriber, Queue<MatchNotification> queue) {
            this.matchId = matchId;
            this.subscriber = subscriber;
            this.queue = queue;
        }
    }
}
