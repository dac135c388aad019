package com.tether.scheduler;

import com.tether.host.HostApplication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FIFO scheduler that runs deferred work on the host's idle callback.
 * 
 * Tasks run one at a time in submission order. A task's completion handler
 * runs before the next task's action starts. A failing action is captured into
 * its {@link TaskResult} and never stops the rest of the queue; only a
 * {@link VirtualMachineError} escapes the drain.
 */
public class IdleTaskScheduler {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(IdleTaskScheduler.class);
    
    private final Queue<Entry> queue = new ConcurrentLinkedQueue<>();
    private final AtomicLong nextSequence = new AtomicLong(0);
    private final AtomicLong completedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);
    private final Runnable idleHandler = this::drain;
    
    private HostApplication boundApplication;
    
    /**
     * Hooks the scheduler into the host's idle callback.
     * 
     * @param application the host to bind to
     * @throws IllegalStateException if already bound to a different host
     */
    public void bind(HostApplication application) {
        Objects.requireNonNull(application, "application");
        if (boundApplication == application) {
            return;
        }
        if (boundApplication != null) {
            throw new IllegalStateException("Scheduler is already bound to another host application");
        }
        application.addIdleHandler(idleHandler);
        boundApplication = application;
        LOGGER.debug("Idle task scheduler bound to host idle callback");
    }
    
    /**
     * Detaches the scheduler from the host's idle callback. Queued tasks stay
     * queued and run if the scheduler is bound again.
     */
    public void unbind() {
        if (boundApplication == null) {
            return;
        }
        boundApplication.removeIdleHandler(idleHandler);
        boundApplication = null;
        LOGGER.debug("Idle task scheduler unbound, {} task(s) still pending", queue.size());
    }
    
    public boolean isBound() {
        return boundApplication != null;
    }
    
    /**
     * Queues a task for the next idle tick. Returns immediately.
     * 
     * @param task the task to run
     */
    public void scheduleForExecution(ScheduledTask task) {
        Objects.requireNonNull(task, "task");
        long sequence = nextSequence.incrementAndGet();
        queue.add(new Entry(sequence, task));
        LOGGER.debug("Scheduled {} as #{} ({} pending)", task.name(), sequence, queue.size());
    }
    
    public void executeOnIdleAsync(String name, IdleAction action) {
        scheduleForExecution(ScheduledTask.of(name, action));
    }
    
    public void executeOnIdleAsync(String name, IdleAction action, TaskCompletionHandler completion) {
        scheduleForExecution(ScheduledTask.of(name, action, completion));
    }
    
    /**
     * Runs the tasks queued before this call, in order. Called from the
     * host's idle callback; tasks queued while draining wait for the next tick.
     * 
     * @throws IdleAffinityException if called while a drain is already running
     */
    public void drain() {
        if (IdleContext.isInIdleContext()) {
            throw new IdleAffinityException("Idle task scheduler cannot drain re-entrantly");
        }
        
        int batch = queue.size();
        if (batch == 0) {
            return;
        }
        
        IdleContext.enter();
        try {
            for (int i = 0; i < batch; i++) {
                Entry entry = queue.poll();
                if (entry == null) {
                    break;
                }
                execute(entry);
            }
        } finally {
            IdleContext.exit();
        }
    }
    
    private void execute(Entry entry) {
        ScheduledTask task = entry.task();
        TaskResult result;
        
        try {
            task.action().run();
            result = TaskResult.success(entry.sequence());
            LOGGER.debug("Executed {} (#{})", task.name(), entry.sequence());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            failedCount.incrementAndGet();
            result = TaskResult.failure(entry.sequence(), e);
            LOGGER.error("Scheduled task {} (#{}) failed", task.name(), entry.sequence(), e);
        }
        
        completedCount.incrementAndGet();
        
        if (task.completion().isPresent()) {
            try {
                task.completion().get().onCompleted(result);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                LOGGER.error("Completion handler of {} (#{}) failed", task.name(), entry.sequence(), e);
            }
        }
    }
    
    public boolean isInIdleContext() {
        return IdleContext.isInIdleContext();
    }
    
    public int getPendingTaskCount() {
        return queue.size();
    }
    
    public SchedulerStats getStats() {
        return new SchedulerStats(nextSequence.get(), completedCount.get(), failedCount.get(), queue.size());
    }
    
    private record Entry(long sequence, ScheduledTask task) {}
    
    /**
     * Counters for diagnostics.
     */
    public record SchedulerStats(long submitted, long completed, long failed, int pending) {}
}
