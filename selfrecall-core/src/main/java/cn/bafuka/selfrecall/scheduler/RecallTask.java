package cn.bafuka.selfrecall.scheduler;

import cn.bafuka.selfrecall.core.DeletableHandle;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * 一次延迟撤回任务
 *
 * 状态流转：SCHEDULED -> WAITING -> DELETING -> DONE，或在删除开始前进入 CANCELLED。
 * 进入终态后从登记表移除并完成 {@link #terminationFuture()}，之后不会再发生任何状态变化。
 * 已经进入 DELETING 的任务不会被打断，删除调用结束后进入 DONE。
 */
@Slf4j
public class RecallTask {

    /**
     * 任务状态
     */
    public enum State {
        SCHEDULED,
        WAITING,
        DELETING,
        DONE,
        CANCELLED;

        public boolean isTerminal() {
            return this == DONE || this == CANCELLED;
        }
    }

    private final long id;

    private final DeletableHandle handle;

    private final Duration delay;

    private final Instant scheduledAt;

    /**
     * 删除操作（平台的 deleteMessage）
     */
    private final Consumer<DeletableHandle> deleter;

    /**
     * 进入终态时的清理回调（从登记表移除）
     */
    private final Consumer<RecallTask> cleanup;

    private final AtomicReference<State> state = new AtomicReference<>(State.SCHEDULED);

    private final CompletableFuture<State> termination = new CompletableFuture<>();

    private volatile ScheduledFuture<?> future;

    private volatile boolean deleteFailed;

    private volatile boolean cancelRequested;

    public RecallTask(long id,
                      DeletableHandle handle,
                      Duration delay,
                      Instant scheduledAt,
                      Consumer<DeletableHandle> deleter,
                      Consumer<RecallTask> cleanup) {
        this.id = id;
        this.handle = handle;
        this.delay = delay;
        this.scheduledAt = scheduledAt;
        this.deleter = deleter;
        this.cleanup = cleanup;
    }

    /**
     * 关联调度器返回的 future，任务随之进入 WAITING
     * 如果任务在关联前已被取消，立即取消这个 future
     *
     * @param scheduledFuture 调度 future
     */
    public void attach(ScheduledFuture<?> scheduledFuture) {
        this.future = scheduledFuture;
        if (!state.compareAndSet(State.SCHEDULED, State.WAITING) && state.get() == State.CANCELLED) {
            scheduledFuture.cancel(false);
        }
    }

    /**
     * 延迟到期，执行删除
     * 删除失败只记录日志；无论成功、失败还是抛出异常，最后都会从登记表移除
     */
    public void fire() {
        if (!enterDeleting()) {
            log.debug("撤回任务已取消，跳过删除: id={}, handle={}", id, handle);
            return;
        }

        try {
            deleter.accept(handle);
            log.info("已自动撤回消息: id={}, handle={}", id, handle);
        } catch (Exception e) {
            deleteFailed = true;
            log.error("撤回消息失败: id={}, handle={}", id, handle, e);
        } finally {
            state.set(State.DONE);
            finish();
        }
    }

    /**
     * 请求取消
     *
     * @return true 表示任务因本次调用进入 CANCELLED；false 表示任务已在删除中或已结束
     */
    public boolean cancel() {
        while (true) {
            State current = state.get();
            if (current == State.DELETING) {
                cancelRequested = true;
                log.debug("撤回任务正在删除，等待其完成: id={}", id);
                return false;
            }
            if (current.isTerminal()) {
                return false;
            }
            if (state.compareAndSet(current, State.CANCELLED)) {
                ScheduledFuture<?> scheduledFuture = future;
                if (scheduledFuture != null) {
                    scheduledFuture.cancel(false);
                }
                log.debug("撤回任务已取消: id={}, handle={}", id, handle);
                finish();
                return true;
            }
        }
    }

    private boolean enterDeleting() {
        while (true) {
            State current = state.get();
            if (current != State.SCHEDULED && current != State.WAITING) {
                return false;
            }
            if (state.compareAndSet(current, State.DELETING)) {
                return true;
            }
        }
    }

    private void finish() {
        try {
            cleanup.accept(this);
        } finally {
            termination.complete(state.get());
        }
    }

    /**
     * 任务进入终态时完成的 future，值为终态
     */
    public CompletableFuture<State> terminationFuture() {
        return termination.copy();
    }

    public long getId() {
        return id;
    }

    public DeletableHandle getHandle() {
        return handle;
    }

    public Duration getDelay() {
        return delay;
    }

    public Instant getScheduledAt() {
        return scheduledAt;
    }

    public State getState() {
        return state.get();
    }

    public boolean isDeleteFailed() {
        return deleteFailed;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    @Override
    public String toString() {
        return "RecallTask{" +
                "id=" + id +
                ", handle=" + handle +
                ", delay=" + delay +
                ", state=" + state.get() +
                '}';
    }
}
