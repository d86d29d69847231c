package cn.bafuka.selfrecall.scheduler.impl;

import cn.bafuka.selfrecall.core.DeletableHandle;
import cn.bafuka.selfrecall.registry.ActionRegistry;
import cn.bafuka.selfrecall.scheduler.RecallScheduler;
import cn.bafuka.selfrecall.scheduler.RecallTask;
import cn.bafuka.selfrecall.spi.ChatPlatformClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于 ScheduledExecutorService 的延迟撤回调度器
 * 每次撤回对应线程池中的一个延迟任务，等待期间不持有任何锁
 */
@Slf4j
public class ExecutorRecallScheduler implements RecallScheduler {

    private final ChatPlatformClient platformClient;

    private final ActionRegistry registry;

    /**
     * 关闭时等待任务结束的超时时间
     */
    private final Duration shutdownTimeout;

    private final Clock clock;

    private final AtomicLong idGenerator = new AtomicLong();

    /**
     * 延迟撤回线程池
     */
    private final ScheduledThreadPoolExecutor executor;

    public ExecutorRecallScheduler(ChatPlatformClient platformClient,
                                   ActionRegistry registry,
                                   int threads,
                                   Duration shutdownTimeout) {
        this(platformClient, registry, threads, shutdownTimeout, Clock.systemUTC());
    }

    public ExecutorRecallScheduler(ChatPlatformClient platformClient,
                                   ActionRegistry registry,
                                   int threads,
                                   Duration shutdownTimeout,
                                   Clock clock) {
        this.platformClient = platformClient;
        this.registry = registry;
        this.shutdownTimeout = shutdownTimeout;
        this.clock = clock;

        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = new ScheduledThreadPoolExecutor(Math.max(1, threads), r -> {
            Thread thread = new Thread(r, "self-recall-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        // 取消的任务立即出队
        this.executor.setRemoveOnCancelPolicy(true);
    }

    @Override
    public RecallTask schedule(DeletableHandle handle, Duration delay) {
        RecallTask task = new RecallTask(
                idGenerator.incrementAndGet(),
                handle,
                delay,
                Instant.now(clock),
                platformClient::deleteMessage,
                finished -> registry.untrack(finished.getId())
        );

        if (!registry.track(task)) {
            task.cancel();
            return task;
        }

        try {
            ScheduledFuture<?> future = executor.schedule(task::fire, delay.toNanos(), TimeUnit.NANOSECONDS);
            task.attach(future);
            log.debug("撤回任务已登记: id={}, handle={}, delay={}", task.getId(), handle, delay);
        } catch (RejectedExecutionException e) {
            log.warn("调度器已关闭，撤回任务被拒绝: handle={}", handle);
            task.cancel();
        }
        return task;
    }

    @Override
    public int activeCount() {
        return registry.size();
    }

    @Override
    public int cancelAll() {
        return registry.cancelAll(shutdownTimeout);
    }

    @Override
    public void shutdown() {
        cancelAll();
        shutdownExecutor();
    }

    /**
     * 优雅关闭撤回线程池
     * 等待中的任务此时已全部取消；超时后仍在删除的任务不会被中断，由守护线程继续执行完
     */
    private void shutdownExecutor() {
        executor.shutdown(); // 不再接受新任务
        try {
            if (executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("撤回线程池已正常关闭");
            } else {
                log.warn("撤回线程池未在 {} 内完成，仍有 {} 个撤回正在删除，不中断", shutdownTimeout, registry.size());
            }
        } catch (InterruptedException e) {
            log.error("关闭被中断", e);
            Thread.currentThread().interrupt();
        }
    }
}
