package com.copytrader.engine;

import com.copytrader.domain.model.MasterOrderEvent;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single ordered channel for master order events.
 *
 * <p>The broker callback only offers the event; a dedicated consumer thread takes events in
 * arrival order and hands each to the dispatcher. The dispatcher schedules follower work and
 * returns, so a slow follower never holds up intake of the next master event.
 *
 * <p>Stopping never interrupts the consumer: dispatch may be writing the order map to the
 * database. Instead a stop marker is queued and the thread exits once the event in hand is done.
 */
public class MasterEventIntake {

    private static final Logger log = LoggerFactory.getLogger(MasterEventIntake.class);

    private static final MasterOrderEvent STOP_MARKER =
            MasterOrderEvent.builder().masterOrderId("intake-stop").build();

    private final Consumer<MasterOrderEvent> dispatcher;
    private final AtomicBoolean running = new AtomicBoolean(false);
    /** Offered but not yet fully dispatched, including the event in hand. */
    private final AtomicInteger undispatched = new AtomicInteger();
    /** Replaced on every start so a stale stop marker never reaches a newer consumer. */
    private volatile BlockingQueue<MasterOrderEvent> queue = new LinkedBlockingQueue<>();

    public MasterEventIntake(Consumer<MasterOrderEvent> dispatcher) {
        this.dispatcher = dispatcher;
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            BlockingQueue<MasterOrderEvent> events = new LinkedBlockingQueue<>();
            queue = events;
            Thread consumerThread = new Thread(() -> processLoop(events), "master-event-intake");
            consumerThread.setDaemon(true);
            consumerThread.start();
            log.info("Master event intake started");
        }
    }

    /** Stops the consumer after the event it is dispatching, if any. Events still queued are dropped. */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            BlockingQueue<MasterOrderEvent> events = queue;
            int dropped = events.size();
            events.clear();
            events.offer(STOP_MARKER);
            undispatched.set(0);
            log.info("Master event intake stopped, {} undispatched event(s) dropped", dropped);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Broker callback entry point. Never blocks. */
    public void offer(MasterOrderEvent event) {
        if (!running.get()) {
            log.debug("Intake stopped, master event ignored: {}", event.getMasterOrderId());
            return;
        }
        undispatched.incrementAndGet();
        queue.offer(event);
    }

    public int backlog() {
        return undispatched.get();
    }

    private void processLoop(BlockingQueue<MasterOrderEvent> events) {
        while (true) {
            MasterOrderEvent event;
            try {
                event = events.take();
            } catch (InterruptedException e) {
                log.warn("Master event intake interrupted, consumer exiting");
                Thread.currentThread().interrupt();
                return;
            }
            if (event == STOP_MARKER) {
                log.debug("Master event intake consumer exiting");
                return;
            }
            try {
                dispatcher.accept(event);
            } catch (RuntimeException e) {
                log.error(
                        "Dispatch failed: masterOrderId={}, type={}, symbol={}",
                        event.getMasterOrderId(),
                        event.getType(),
                        event.getSymbol(),
                        e);
            } finally {
                undispatched.updateAndGet(count -> Math.max(0, count - 1));
            }
        }
    }
}
