package cn.bafuka.selfrecall.policy;

import cn.bafuka.selfrecall.core.SessionId;
import cn.bafuka.selfrecall.model.DelayMode;
import cn.bafuka.selfrecall.model.RecallPolicyConfig;

/**
 * 群聊默认撤回时间策略
 */
public interface DelayStrategy {

    /**
     * 计算群聊的默认撤回时间
     *
     * @param session 群聊会话
     * @param config  当前配置快照
     * @return 撤回时间（配置单位）
     */
    long groupDelay(SessionId session, RecallPolicyConfig config);

    /**
     * 对应的配置模式
     */
    DelayMode mode();
}
