package com.crowd.service.impl;

import com.crowd.config.CrowdGeoProperties;
import com.crowd.model.Signal;
import com.crowd.repository.DocumentEventListener;
import com.crowd.repository.DocumentStore;
import com.crowd.service.DensityAggregationService;
import com.crowd.service.RecomputeDispatcher;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Turns signal mutations into density recompute passes run by single-thread workers.
 *
 * Each group is always routed to the same worker, so two worker passes over one group never
 * overlap. A chunk can still be rejected when a signal is mutated during the pass, which
 * schedules its own pass, or when an on-demand recompute of the same group commits first;
 * in both cases the winning writer classified the newer state. A group waiting in a queue
 * is not queued again; once a worker has taken it, a new mutation queues it anew so the
 * group converges on the latest state.
 */
@Component
public class QueuedRecomputeDispatcher implements RecomputeDispatcher, DocumentEventListener<Signal> {
    
    private static final Logger logger = LoggerFactory.getLogger(QueuedRecomputeDispatcher.class);
    
    private static final long POLL_INTERVAL_MS = 200;
    
    private final DensityAggregationService aggregationService;
    private final DocumentStore<Signal> signalStore;
    private final CrowdGeoProperties properties;
    
    // One queue per worker, indexed by group hash
    private final List<BlockingQueue<String>> queues = new ArrayList<>();
    private final Set<String> queued = ConcurrentHashMap.newKeySet();
    private final List<ThreadPoolTaskExecutor> workers = new ArrayList<>();
    
    // Groups queued or being recomputed, guarded by idleMonitor
    private final Object idleMonitor = new Object();
    private int outstanding;
    
    private volatile boolean running;
    
    public QueuedRecomputeDispatcher(DensityAggregationService aggregationService,
                                     @Qualifier("signalStore") DocumentStore<Signal> signalStore,
                                     CrowdGeoProperties properties) {
        this.aggregationService = aggregationService;
        this.signalStore = signalStore;
        this.properties = properties;
        
        if (properties.getRecomputeWorkers() < 1) {
            throw new IllegalArgumentException("At least one recompute worker is required");
        }
        for (int i = 0; i < properties.getRecomputeWorkers(); i++) {
            queues.add(new LinkedBlockingQueue<>());
        }
    }
    
    @PostConstruct
    public void start() {
        running = true;
        for (int i = 0; i < queues.size(); i++) {
            BlockingQueue<String> queue = queues.get(i);
            ThreadPoolTaskExecutor worker = new ThreadPoolTaskExecutor();
            worker.setCorePoolSize(1);
            worker.setMaxPoolSize(1);
            worker.setQueueCapacity(0);
            worker.setThreadNamePrefix("crowd-recompute-" + (i + 1) + "-");
            worker.setDaemon(true);
            worker.setAwaitTerminationSeconds(5);
            worker.initialize();
            worker.execute(() -> drain(queue));
            workers.add(worker);
        }
        signalStore.addListener(this);
        logger.info("Started {} recompute workers on collection {}", workers.size(), signalStore.name());
    }
    
    @PreDestroy
    public void stop() {
        running = false;
        // Interrupts the drain loops and waits for a running pass to return
        workers.forEach(ThreadPoolTaskExecutor::shutdown);
        workers.clear();
        
        int unprocessed = pending();
        queues.forEach(BlockingQueue::clear);
        queued.clear();
        synchronized (idleMonitor) {
            outstanding = 0;
            idleMonitor.notifyAll();
        }
        logger.info("Stopped recompute workers, {} groups left unprocessed", unprocessed);
    }
    
    @Override
    public void onCreate(Signal signal) {
        enqueue(signal.getCell());
    }
    
    @Override
    public void onUpdate(Signal before, Signal after) {
        // The update may have overwritten a density written by a concurrent pass
        enqueue(after.getCell());
        if (!Objects.equals(groupOf(before.getCell()), groupOf(after.getCell()))) {
            enqueue(before.getCell());
        }
    }
    
    @Override
    public void onDelete(Signal signal) {
        enqueue(signal.getCell());
    }
    
    @Override
    public void enqueue(String cell) {
        String group = groupOf(cell);
        if (group == null) {
            logger.warn("Ignoring recompute request for cell '{}' shorter than the grouping precision", cell);
            return;
        }
        if (!queued.add(group)) {
            logger.debug("Group {} already queued for recompute", group);
            return;
        }
        synchronized (idleMonitor) {
            outstanding++;
        }
        queues.get(Math.floorMod(group.hashCode(), queues.size())).offer(group);
    }
    
    @Override
    public int pending() {
        int pending = 0;
        for (BlockingQueue<String> queue : queues) {
            pending += queue.size();
        }
        return pending;
    }
    
    @Override
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        synchronized (idleMonitor) {
            while (outstanding > 0) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    return false;
                }
                idleMonitor.wait(remaining);
            }
            return true;
        }
    }
    
    private void drain(BlockingQueue<String> queue) {
        while (running) {
            String group;
            try {
                group = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (group == null) {
                continue;
            }
            
            // Released before the pass so mutations made during it schedule another one
            queued.remove(group);
            try {
                aggregationService.recomputeCellGroup(group, properties.getGroupingPrecision());
            } catch (RuntimeException e) {
                logger.error("Recompute of group {} failed", group, e);
            } finally {
                synchronized (idleMonitor) {
                    // Already reset when the dispatcher was stopped mid-pass
                    if (outstanding > 0) {
                        outstanding--;
                    }
                    idleMonitor.notifyAll();
                }
            }
        }
    }
    
    private String groupOf(String cell) {
        int precision = properties.getGroupingPrecision();
        if (cell == null || cell.length() < precision) {
            return null;
        }
        return cell.substring(0, precision);
    }
}
