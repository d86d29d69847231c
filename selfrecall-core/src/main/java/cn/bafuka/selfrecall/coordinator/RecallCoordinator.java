package cn.bafuka.selfrecall.coordinator;

import cn.bafuka.selfrecall.core.SessionId;

/**
 * 撤回协调器接口
 * 把策略判定、一次性覆盖和调度器串起来，自身不持有长期状态
 */
public interface RecallCoordinator {

    /**
     * 处理一条机器人发出的消息
     * 依次：策略判定 -> 读取一次性覆盖或默认延迟 -> 取得消息句柄 -> 安排撤回。
     * 不会向宿主抛出异常
     *
     * @param event 消息发送后事件
     * @return 处理结果
     */
    RecallResult onOutgoingMessage(OutgoingMessageEvent event);

    /**
     * 通过平台发送消息并按策略安排撤回
     * 发送失败时返回 FAILED，不向宿主抛出异常
     *
     * @param session 会话
     * @param content 消息内容
     * @return 处理结果
     */
    RecallResult sendAndRecall(SessionId session, String content);

    /**
     * 取消所有撤回任务并清空一次性覆盖
     */
    void shutdown();
}
