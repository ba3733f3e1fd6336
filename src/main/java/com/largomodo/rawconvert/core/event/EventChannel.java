package com.largomodo.rawconvert.core.event;

import com.largomodo.rawconvert.core.ConversionObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Single-subscriber, multi-publisher event channel.
 * <p>
 * Publishers (scheduler and workers) enqueue into an unbounded queue and return at once.
 * One dispatcher thread drains the queue and hands each event, whole, to the subscriber,
 * so the subscriber sees events strictly one at a time in the order the queue received
 * them. No order is implied between events of different publishers.
 * <p>
 * Events published before {@link #subscribe} are buffered and delivered once the
 * subscriber arrives. {@link #close()} delivers everything already queued, then stops the
 * dispatcher; later publications are dropped.
 */
public class EventChannel implements EventSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventChannel.class);

    static final String DISPATCHER_THREAD_NAME = "rawconvert-events";

    private static final Envelope END_OF_STREAM = new Envelope(null);

    private final BlockingQueue<Envelope> queue = new LinkedBlockingQueue<>();

    // Publishers share the read lock; close() takes the write lock so that no event can be
    // enqueued behind the end-of-stream marker.
    private final ReadWriteLock closeLock = new ReentrantReadWriteLock();

    private boolean closed;
    private ConversionObserver subscriber;
    private Thread dispatcher;

    /**
     * Enqueue an event for delivery. Never waits for the subscriber.
     *
     * @param event the event to deliver, not null
     */
    @Override
    public void publish(ConversionEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event is required");
        }
        closeLock.readLock().lock();
        try {
            if (closed) {
                log.debug("Channel closed, dropping {}", event);
                return;
            }
            queue.add(new Envelope(event));
        } finally {
            closeLock.readLock().unlock();
        }
    }

    /**
     * Register the single consumer and start delivery.
     *
     * @throws IllegalStateException if a subscriber is already registered or the channel is closed
     */
    public synchronized void subscribe(ConversionObserver observer) {
        if (observer == null) {
            throw new IllegalArgumentException("observer is required");
        }
        if (subscriber != null) {
            throw new IllegalStateException("Event channel already has a subscriber");
        }
        closeLock.readLock().lock();
        try {
            if (closed) {
                throw new IllegalStateException("Event channel is closed");
            }
        } finally {
            closeLock.readLock().unlock();
        }

        subscriber = observer;
        dispatcher = new Thread(this::dispatchLoop, DISPATCHER_THREAD_NAME);
        dispatcher.setDaemon(true);
        dispatcher.start();
    }

    /**
     * Number of events waiting for delivery.
     */
    public int pending() {
        return (int) queue.stream().filter(e -> e != END_OF_STREAM).count();
    }

    /**
     * Deliver all queued events, then stop the dispatcher. Idempotent.
     * <p>
     * Blocks until the subscriber has received every event published before this call.
     * Without a subscriber, queued events are discarded.
     */
    @Override
    public void close() {
        Thread toJoin;
        synchronized (this) {
            closeLock.writeLock().lock();
            try {
                if (closed) {
                    return;
                }
                closed = true;
                queue.add(END_OF_STREAM);
            } finally {
                closeLock.writeLock().unlock();
            }
            toJoin = dispatcher;
        }

        if (toJoin == null) {
            log.debug("Event channel closed without subscriber, {} events discarded", queue.size() - 1);
            queue.clear();
            return;
        }
        if (toJoin == Thread.currentThread()) {
            return;
        }
        try {
            toJoin.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining event channel, {} events undelivered", pending());
        }
    }

    private void dispatchLoop() {
        try {
            while (true) {
                Envelope envelope = queue.take();
                if (envelope == END_OF_STREAM) {
                    return;
                }
                deliver(envelope.event());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Event dispatcher interrupted, {} events undelivered", pending());
        }
    }

    private void deliver(ConversionEvent event) {
        try {
            event.dispatchTo(subscriber);
        } catch (RuntimeException e) {
            // Subscriber failure must not stop delivery of later events
            log.error("Event subscriber failed on {}: {}", event, e.getMessage(), e);
        }
    }

    private record Envelope(ConversionEvent event) {
    }
}
