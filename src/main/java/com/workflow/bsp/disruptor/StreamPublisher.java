package com.workflow.bsp.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.workflow.bsp.api.StreamConsumer;
import com.workflow.bsp.util.ErrorRateLimiter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Hands stream events from the coordinator to a {@link StreamConsumer} through
 * an LMAX Disruptor ring buffer.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>The coordinator thread claims the next slot and fills it in
 * {@link #publish}. It is the only producer.</li>
 * <li>A dedicated daemon thread delivers each slot to the consumer in sequence
 * order.</li>
 * <li><b>Backpressure:</b> when the consumer falls a whole ring behind,
 * claiming a slot blocks the coordinator until a slot frees up. Events are
 * never dropped.</li>
 * </ol>
 *
 * {@link #close()} returns only after every published event was delivered.
 * A consumer that throws loses that one event; the failure is logged,
 * throttled, and delivery continues.
 */
public final class StreamPublisher implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(StreamPublisher.class);

    private final Disruptor<StreamEventSlot> disruptor;
    private final RingBuffer<StreamEventSlot> ringBuffer;
    private final ErrorRateLimiter errorLimiter = new ErrorRateLimiter(log, 1000);
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private long published;
    private boolean closed;

    /**
     * @param bufferSize ring size, a power of two
     */
    public StreamPublisher(StreamConsumer consumer, int bufferSize) {
        this.disruptor = new Disruptor<>(
                StreamEventSlot::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());

        EventHandler<StreamEventSlot> handler = (slot, sequence, endOfBatch) -> {
            try {
                consumer.onEvent(slot.toEvent());
                delivered.incrementAndGet();
            } finally {
                slot.clear();
            }
        };
        disruptor.handleEventsWith(handler);
        disruptor.setDefaultExceptionHandler(new ExceptionHandler<StreamEventSlot>() {
            @Override
            public void handleEventException(Throwable ex, long sequence, StreamEventSlot slot) {
                failed.incrementAndGet();
                errorLimiter.log("Stream consumer failed on event #" + sequence, ex);
            }

            @Override
            public void handleOnStartException(Throwable ex) {
                log.error("Stream publisher failed to start", ex);
            }

            @Override
            public void handleOnShutdownException(Throwable ex) {
                log.error("Stream publisher failed to shut down", ex);
            }
        });
        this.ringBuffer = disruptor.start();
        log.debug("Stream publisher started, ring size {}", bufferSize);
    }

    /**
     * Publishes one event. Blocks while the ring is full.
     *
     * @throws IllegalStateException if the publisher was closed
     */
    public void publish(String nodeName, Map<String, List<Object>> deltas, long superstep) {
        if (closed)
            throw new IllegalStateException("Stream publisher is closed");
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(nodeName, deltas, superstep);
        } finally {
            ringBuffer.publish(sequence);
        }
        published++;
    }

    public long publishedCount() {
        return published;
    }

    public long deliveredCount() {
        return delivered.get();
    }

    public long failedCount() {
        return failed.get();
    }

    public int bufferSize() {
        return ringBuffer.getBufferSize();
    }

    /** Waits until every published event was handled, then stops the handler thread. */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        disruptor.shutdown();
        log.debug("Stream publisher stopped: {} published, {} delivered, {} failed",
                published, delivered.get(), failed.get());
    }
}
