package cn.bafuka.selfrecall.policy.impl;

import cn.bafuka.selfrecall.core.SessionId;
import cn.bafuka.selfrecall.model.DelayMode;
import cn.bafuka.selfrecall.model.RecallPolicyConfig;
import cn.bafuka.selfrecall.policy.DelayStrategy;

/**
 * 所有群统一使用 groupRecallTime
 */
public class FlatDelayStrategy implements DelayStrategy {

    @Override
    public long groupDelay(SessionId session, RecallPolicyConfig config) {
        return config.getGroupRecallTime();
    }

    @Override
    public DelayMode mode() {
        return DelayMode.FLAT;
    }
}
