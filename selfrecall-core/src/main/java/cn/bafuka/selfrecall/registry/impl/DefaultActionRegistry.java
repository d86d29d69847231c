package cn.bafuka.selfrecall.registry.impl;

import cn.bafuka.selfrecall.registry.ActionRegistry;
import cn.bafuka.selfrecall.scheduler.RecallTask;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 撤回任务登记表默认实现
 * track 与 cancelAll 共用一把锁：cancelAll 关闭登记表后，不会再有任务漏登记
 */
@Slf4j
public class DefaultActionRegistry implements ActionRegistry {

    /**
     * 登记中的任务
     * Key: 任务 ID
     * Value: 任务
     */
    private final Map<Long, RecallTask> tasks = new ConcurrentHashMap<>();

    private final Object lock = new Object();

    private volatile boolean accepting = true;

    @Override
    public boolean track(RecallTask task) {
        synchronized (lock) {
            if (!accepting) {
                log.warn("登记表已关闭，拒绝撤回任务: {}", task);
                return false;
            }
            tasks.put(task.getId(), task);
        }
        return true;
    }

    @Override
    public void untrack(long taskId) {
        tasks.remove(taskId);
    }

    @Override
    public int cancelAll(Duration timeout) {
        List<RecallTask> pending;
        synchronized (lock) {
            accepting = false;
            pending = new ArrayList<>(tasks.values());
        }

        if (pending.isEmpty()) {
            return 0;
        }

        log.info("取消 {} 个撤回任务...", pending.size());

        int cancelled = 0;
        List<CompletableFuture<RecallTask.State>> terminations = new ArrayList<>(pending.size());
        for (RecallTask task : pending) {
            if (task.cancel()) {
                cancelled++;
            }
            terminations.add(task.terminationFuture());
        }

        try {
            CompletableFuture.allOf(terminations.toArray(new CompletableFuture[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("撤回任务已全部结束: cancelled={}, finishedDeleting={}",
                    cancelled, pending.size() - cancelled);
        } catch (TimeoutException e) {
            log.warn("等待撤回任务结束超时: timeout={}, remaining={}", timeout, tasks.size());
        } catch (InterruptedException e) {
            log.error("等待撤回任务结束被中断", e);
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.error("等待撤回任务结束失败", e);
        }

        return pending.size();
    }

    @Override
    public int size() {
        return tasks.size();
    }

    @Override
    public List<RecallTask> snapshot() {
        return new ArrayList<>(tasks.values());
    }

    @Override
    public boolean isAccepting() {
        return accepting;
    }
}
