package cn.bafuka.selfrecall.coordinator;

import cn.bafuka.selfrecall.core.SessionId;
import cn.bafuka.selfrecall.scheduler.RecallTask;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

/**
 * 一次撤回判定的结果
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RecallResult {

    /**
     * 结果状态
     */
    public enum Status {
        /**
         * 已安排撤回
         */
        SCHEDULED,

        /**
         * 策略未启用，什么都不做
         */
        POLICY_DISABLED,

        /**
         * 拿不到可撤回的消息句柄，跳过
         */
        HANDLE_UNRESOLVED,

        /**
         * 调度器正在关闭，任务被拒绝
         */
        REJECTED,

        /**
         * 处理过程中出现意外异常
         */
        FAILED
    }

    Status status;

    SessionId session;

    /**
     * 实际使用的撤回延迟，未安排时为 null
     */
    Duration delay;

    /**
     * 是否使用了一次性覆盖
     */
    boolean overrideUsed;

    /**
     * 撤回任务，未安排时为 null
     */
    RecallTask task;

    public static RecallResult scheduled(SessionId session, Duration delay, boolean overrideUsed, RecallTask task) {
        return new RecallResult(Status.SCHEDULED, session, delay, overrideUsed, task);
    }

    public static RecallResult rejected(SessionId session, Duration delay, boolean overrideUsed, RecallTask task) {
        return new RecallResult(Status.REJECTED, session, delay, overrideUsed, task);
    }

    public static RecallResult failed(SessionId session) {
        return new RecallResult(Status.FAILED, session, null, false, null);
    }

    public static RecallResult policyDisabled(SessionId session) {
        return new RecallResult(Status.POLICY_DISABLED, session, null, false, null);
    }

    public static RecallResult handleUnresolved(SessionId session, Duration delay, boolean overrideUsed) {
        return new RecallResult(Status.HANDLE_UNRESOLVED, session, delay, overrideUsed, null);
    }

    public boolean isScheduled() {
        return status == Status.SCHEDULED;
    }
}
