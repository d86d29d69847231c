package cn.bafuka.selfrecall.control.impl;

import cn.bafuka.selfrecall.control.PolicyConfigManager;
import cn.bafuka.selfrecall.exception.RecallException;
import cn.bafuka.selfrecall.model.RecallPolicyConfig;
import cn.bafuka.selfrecall.spi.RecallConfigSource;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 策略配置管理器默认实现
 */
@Slf4j
public class DefaultPolicyConfigManager implements PolicyConfigManager {

    /**
     * 配置源
     */
    private final RecallConfigSource configSource;

    /**
     * 当前生效的配置
     */
    private volatile RecallPolicyConfig current = RecallPolicyConfig.defaults();

    /**
     * 是否已初始化
     */
    private volatile boolean initialized = false;

    /**
     * 是否已有配置源推送的配置生效
     */
    private volatile boolean loaded = false;

    public DefaultPolicyConfigManager(RecallConfigSource configSource) {
        this.configSource = configSource;
    }

    @Override
    public void initialize() {
        if (initialized) {
            log.debug("PolicyConfigManager already initialized, skipping");
            return;
        }

        log.info("初始化 PolicyConfigManager from source: {}", configSource.getType());
        configSource.subscribe(this::apply);
        if (!loaded) {
            // 不能退回到全部开启的默认配置
            throw new RecallException(RecallException.Reason.CONFIG_ERROR,
                    "撤回策略初始加载失败，配置源: " + configSource.getType());
        }
        initialized = true;
        log.info("PolicyConfigManager initialized: {}", current);
    }

    @Override
    public RecallPolicyConfig getCurrent() {
        return current;
    }

    @Override
    public synchronized boolean apply(RecallPolicyConfig config) {
        if (config == null) {
            log.warn("忽略空的撤回策略");
            return false;
        }

        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            log.error("撤回策略校验失败，保留旧配置: error={}", e.getMessage());
            return false;
        }

        current = config;
        loaded = true;
        log.info("撤回策略已生效: private={}({}s), group={}({}s), whitelist={}, mode={}",
                config.isEnablePrivateRecall(), config.getPrivateRecallTime(),
                config.isEnableGroupRecall(), config.getGroupRecallTime(),
                config.getGroupWhitelist().size(), config.getDelayMode());
        return true;
    }

    @Override
    public synchronized boolean addToWhitelist(String groupId) {
        Set<String> whitelist = new LinkedHashSet<>(current.getGroupWhitelist());
        if (!whitelist.add(groupId)) {
            return false;
        }
        saveWhitelist(whitelist);
        log.info("群已加入撤回白名单: groupId={}", groupId);
        return true;
    }

    @Override
    public synchronized boolean removeFromWhitelist(String groupId) {
        Set<String> whitelist = new LinkedHashSet<>(current.getGroupWhitelist());
        if (!whitelist.remove(groupId)) {
            return false;
        }
        saveWhitelist(whitelist);
        log.info("群已移出撤回白名单: groupId={}", groupId);
        return true;
    }

    @Override
    public void shutdown() {
        if (!initialized) {
            return;
        }
        configSource.shutdown();
        initialized = false;
        log.info("PolicyConfigManager 已关闭");
    }

    /**
     * 先写回配置源，成功后再替换内存快照，写回失败时内存保持不变
     */
    private void saveWhitelist(Set<String> whitelist) {
        configSource.saveWhitelist(whitelist);
        current = current.toBuilder()
                .clearGroupWhitelist()
                .groupWhitelist(whitelist)
                .build();
    }
}
