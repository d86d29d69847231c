package cn.bafuka.selfrecall.policy;

import cn.bafuka.selfrecall.core.SessionId;

import java.time.Duration;

/**
 * 撤回策略判定接口
 * 纯函数：只读取当前配置快照，可被多个会话并发调用
 */
public interface RecallPolicyResolver {

    /**
     * 判断该会话发出的消息是否需要撤回
     *
     * @param session 会话
     * @return true 表示需要撤回
     */
    boolean shouldRecall(SessionId session);

    /**
     * 计算该会话的默认撤回时间
     *
     * @param session 会话
     * @return 撤回延迟
     */
    Duration resolveDelay(SessionId session);

    /**
     * 校验用户手动设置的撤回时间
     *
     * @param amount 撤回时间（配置单位，通常为秒）
     * @return 对应的撤回延迟
     * @throws cn.bafuka.selfrecall.exception.RecallException INVALID_DELAY，当 amount &lt;= 0 或超过上限
     */
    Duration validateDelay(long amount);

    /**
     * 将配置单位的数值换算为延迟
     */
    Duration toDuration(long amount);
}
