package cn.bafuka.selfrecall.policy.impl;

import cn.bafuka.selfrecall.control.PolicyConfigManager;
import cn.bafuka.selfrecall.core.SessionId;
import cn.bafuka.selfrecall.exception.RecallException;
import cn.bafuka.selfrecall.model.DelayMode;
import cn.bafuka.selfrecall.model.RecallPolicyConfig;
import cn.bafuka.selfrecall.policy.DelayStrategy;
import cn.bafuka.selfrecall.policy.RecallPolicyResolver;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 撤回策略判定默认实现
 * 群聊默认时间按配置中的 delayMode 选择对应的 {@link DelayStrategy}
 */
@Slf4j
public class DefaultRecallPolicyResolver implements RecallPolicyResolver {

    private final PolicyConfigManager configManager;

    private final Map<DelayMode, DelayStrategy> strategies = new EnumMap<>(DelayMode.class);

    /**
     * 配置中撤回时间的单位
     */
    private final TimeUnit timeUnit;

    public DefaultRecallPolicyResolver(PolicyConfigManager configManager,
                                       List<DelayStrategy> strategies,
                                       TimeUnit timeUnit) {
        this.configManager = configManager;
        this.timeUnit = timeUnit;
        for (DelayStrategy strategy : strategies) {
            this.strategies.put(strategy.mode(), strategy);
        }
        if (!this.strategies.containsKey(DelayMode.FLAT)) {
            this.strategies.put(DelayMode.FLAT, new FlatDelayStrategy());
        }
    }

    @Override
    public boolean shouldRecall(SessionId session) {
        RecallPolicyConfig config = configManager.getCurrent();
        if (session.isPrivate()) {
            return config.isEnablePrivateRecall();
        }
        if (!config.isEnableGroupRecall()) {
            return false;
        }
        return config.isGroupAllowed(session.groupId());
    }

    @Override
    public Duration resolveDelay(SessionId session) {
        RecallPolicyConfig config = configManager.getCurrent();
        if (session.isPrivate()) {
            return toDuration(config.getPrivateRecallTime());
        }

        DelayStrategy strategy = strategies.get(config.getDelayMode());
        if (strategy == null) {
            log.warn("未注册 {} 模式的撤回时间策略，使用统一群聊时间", config.getDelayMode());
            strategy = strategies.get(DelayMode.FLAT);
        }
        return toDuration(strategy.groupDelay(session, config));
    }

    @Override
    public Duration validateDelay(long amount) {
        long max = configManager.getCurrent().getMaxRecallTime();
        if (amount <= 0) {
            throw new RecallException(RecallException.Reason.INVALID_DELAY, "撤回时间必须大于0秒");
        }
        if (amount > max) {
            throw new RecallException(RecallException.Reason.INVALID_DELAY, "撤回时间不能超过" + max + "秒");
        }
        return toDuration(amount);
    }

    @Override
    public Duration toDuration(long amount) {
        return Duration.ofNanos(timeUnit.toNanos(amount));
    }
}
