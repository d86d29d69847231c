package cn.bafuka.selfrecall.registry;

import cn.bafuka.selfrecall.scheduler.RecallTask;

import java.time.Duration;
import java.util.List;

/**
 * 撤回任务登记表
 * 记录所有可能仍会执行的撤回任务，关闭时据此统一取消
 */
public interface ActionRegistry {

    /**
     * 登记任务
     *
     * @param task 撤回任务
     * @return false 表示登记表已关闭，任务未被登记
     */
    boolean track(RecallTask task);

    /**
     * 移除任务，重复移除不报错
     *
     * @param taskId 任务 ID
     */
    void untrack(long taskId);

    /**
     * 停止接收新任务，取消所有已登记的任务，并等待它们全部进入终态
     *
     * @param timeout 最长等待时间
     * @return 本次处理的任务数
     */
    int cancelAll(Duration timeout);

    /**
     * 当前登记的任务数
     */
    int size();

    /**
     * 当前登记任务的快照
     */
    List<RecallTask> snapshot();

    /**
     * 是否仍在接收新任务
     */
    boolean isAccepting();
}
