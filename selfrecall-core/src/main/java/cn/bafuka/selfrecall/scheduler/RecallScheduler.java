package cn.bafuka.selfrecall.scheduler;

import cn.bafuka.selfrecall.core.DeletableHandle;

import java.time.Duration;

/**
 * 延迟撤回调度器接口
 */
public interface RecallScheduler {

    /**
     * 安排一次延迟撤回
     * 调用方不会等待延迟结束；任务被登记表拒绝时直接返回 CANCELLED 状态的任务
     *
     * @param handle 消息句柄
     * @param delay  撤回延迟
     * @return 撤回任务
     */
    RecallTask schedule(DeletableHandle handle, Duration delay);

    /**
     * 当前仍可能执行的任务数
     */
    int activeCount();

    /**
     * 取消所有任务并等待它们结束
     *
     * @return 处理的任务数
     */
    int cancelAll();

    /**
     * 关闭调度器：先 cancelAll，再关闭线程池
     */
    void shutdown();
}
