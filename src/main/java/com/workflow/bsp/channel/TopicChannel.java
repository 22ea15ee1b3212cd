package com.workflow.bsp.channel;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.workflow.bsp.error.EmptyChannelException;
import com.workflow.bsp.error.InvalidOperationException;
import com.workflow.bsp.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Topic -- a bounded, TTL-expiring log with fan-out to subscribers.
 *
 * {@link #update(List)} appends every value to the log, evicting the oldest
 * entries beyond {@code capacity}, and stages it for delivery. Staged values
 * reach subscribers only when {@link #deliverPending()} runs, which the
 * coordinator does after a write phase has been committed. A restored or
 * rolled-back topic therefore never delivers values that were not committed.
 *
 * {@link #get()} returns the live (non-expired) values, oldest first. Expired
 * entries are pruned on update; reads filter them without mutating the log.
 */
public final class TopicChannel<V> extends Channel<List<V>, V, List<TopicChannel.Entry<V>>> {
    private static final Logger log = LogManager.getLogger(TopicChannel.class);
    private static final ErrorRateLimiter deliveryErrors = new ErrorRateLimiter(log, 1000);

    /** A published value and the wall-clock time it was appended. */
    public record Entry<V>(V value, long publishedAtMillis) {
    }

    private final Class<?> valueType;
    private final int capacity;
    private final long ttlMillis;
    private final DeliveryMode deliveryMode;
    private final Clock clock;

    private final ArrayDeque<Entry<V>> entries = new ArrayDeque<>();
    private final List<V> staged = new ArrayList<>();
    private final Map<String, Subscriber> subscribers = new LinkedHashMap<>();

    TopicChannel(String name, Class<?> valueType, int capacity, Duration ttl, DeliveryMode deliveryMode, Clock clock) {
        super(name, valueType);
        if (capacity <= 0)
            throw new IllegalArgumentException("Topic capacity must be positive: " + capacity);
        this.valueType = valueType;
        this.capacity = capacity;
        this.ttlMillis = ttl == null ? 0 : ttl.toMillis();
        this.deliveryMode = deliveryMode;
        this.clock = clock;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.TOPIC;
    }

    @Override
    public List<V> get() {
        List<V> live = liveValues();
        if (live.isEmpty())
            throw new EmptyChannelException(name());
        return live;
    }

    @Override
    public boolean isAvailable() {
        long now = clock.millis();
        for (Entry<V> e : entries)
            if (!expired(e, now))
                return true;
        return false;
    }

    @Override
    public boolean update(List<V> updates) {
        long now = clock.millis();
        boolean pruned = prune(now);
        if (updates.isEmpty())
            return pruned;
        for (V value : updates) {
            entries.addLast(new Entry<>(value, now));
            if (entries.size() > capacity)
                entries.removeFirst();
            staged.add(value);
        }
        return true;
    }

    /**
     * Pushes staged values to every active subscriber and retries values still
     * queued from earlier failed at-least-once deliveries.
     *
     * @return number of successful deliveries
     */
    public int deliverPending() {
        if (subscribers.isEmpty()) {
            staged.clear();
            return 0;
        }
        for (Subscriber s : subscribers.values())
            for (V value : staged)
                s.enqueue(value);
        staged.clear();

        int delivered = 0;
        for (Subscriber s : new ArrayList<>(subscribers.values()))
            delivered += s.drain();
        return delivered;
    }

    TopicSubscription subscribe(String id, Consumer<? super V> consumer) {
        if (subscribers.containsKey(id))
            throw new InvalidOperationException(name(), "subscriber '" + id + "' is already registered");
        Subscriber s = new Subscriber(id, consumer);
        subscribers.put(id, s);
        return s;
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public DeliveryMode deliveryMode() {
        return deliveryMode;
    }

    @Override
    public List<Entry<V>> checkpoint() {
        return new ArrayList<>(entries);
    }

    @Override
    public void restore(List<Entry<V>> checkpoint) {
        entries.clear();
        staged.clear();
        if (checkpoint == null)
            return;
        for (Entry<V> e : checkpoint) {
            entries.addLast(e);
            if (entries.size() > capacity)
                entries.removeFirst();
        }
    }

    @Override
    public JavaType checkpointType(TypeFactory types) {
        JavaType entry = types.constructParametricType(Entry.class, types.constructType(valueType));
        return types.constructCollectionType(List.class, entry);
    }

    private List<V> liveValues() {
        long now = clock.millis();
        List<V> out = new ArrayList<>(entries.size());
        for (Entry<V> e : entries)
            if (!expired(e, now))
                out.add(e.value());
        return Collections.unmodifiableList(out);
    }

    private boolean prune(long now) {
        boolean removed = false;
        while (!entries.isEmpty() && expired(entries.peekFirst(), now)) {
            entries.removeFirst();
            removed = true;
        }
        return removed;
    }

    private boolean expired(Entry<V> e, long now) {
        return ttlMillis > 0 && now - e.publishedAtMillis() >= ttlMillis;
    }

    private final class Subscriber implements TopicSubscription {
        private final String id;
        private final Consumer<? super V> consumer;
        private final ArrayDeque<V> backlog = new ArrayDeque<>();
        private boolean active = true;
        private long failures;

        Subscriber(String id, Consumer<? super V> consumer) {
            this.id = id;
            this.consumer = consumer;
        }

        void enqueue(V value) {
            backlog.addLast(value);
            if (backlog.size() > capacity) {
                backlog.removeFirst();
                log.warn("Topic '{}' subscriber '{}' backlog over capacity {}, oldest value dropped",
                        name(), id, capacity);
            }
        }

        int drain() {
            int delivered = 0;
            while (active && !backlog.isEmpty()) {
                V value = deliveryMode == DeliveryMode.AT_MOST_ONCE ? backlog.pollFirst() : backlog.peekFirst();
                try {
                    consumer.accept(value);
                } catch (RuntimeException e) {
                    failures++;
                    deliveryErrors.log("Topic '" + name() + "' delivery to '" + id + "' failed", e);
                    if (deliveryMode == DeliveryMode.AT_LEAST_ONCE)
                        break; // retried on the next delivery pass
                    continue;
                }
                if (deliveryMode == DeliveryMode.AT_LEAST_ONCE)
                    backlog.pollFirst();
                delivered++;
            }
            return delivered;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public int pending() {
            return backlog.size();
        }

        @Override
        public long failedDeliveries() {
            return failures;
        }

        @Override
        public void cancel() {
            active = false;
            backlog.clear();
            subscribers.remove(id);
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}
