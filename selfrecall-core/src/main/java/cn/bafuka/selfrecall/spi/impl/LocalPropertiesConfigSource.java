package cn.bafuka.selfrecall.spi.impl;

import cn.bafuka.selfrecall.config.SelfRecallProperties;
import cn.bafuka.selfrecall.model.RecallPolicyConfig;
import cn.bafuka.selfrecall.spi.RecallConfigSource;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.function.Consumer;

/**
 * 本地配置源实现
 * 从 Spring Boot 配置文件读取撤回策略，白名单修改只保存在内存中，重启后恢复为配置文件内容
 */
@Slf4j
public class LocalPropertiesConfigSource implements RecallConfigSource {

    /**
     * 当前配置
     */
    private volatile RecallPolicyConfig current;

    public LocalPropertiesConfigSource(SelfRecallProperties properties) {
        this.current = properties.getPolicy() == null
                ? RecallPolicyConfig.defaults()
                : properties.getPolicy().toConfig();
    }

    @Override
    public void subscribe(Consumer<RecallPolicyConfig> listener) {
        // 本地配置源只在启动时加载一次
        log.info("加载撤回策略 from local configuration");
        if (listener != null) {
            listener.accept(current);
        }
    }

    @Override
    public RecallPolicyConfig getCurrentConfig() {
        return current;
    }

    @Override
    public synchronized void saveWhitelist(Set<String> groupWhitelist) {
        current = current.toBuilder()
                .clearGroupWhitelist()
                .groupWhitelist(groupWhitelist)
                .build();
        log.info("白名单已更新（仅内存）: size={}", groupWhitelist.size());
    }

    @Override
    public void shutdown() {
        log.info("关闭 LocalPropertiesConfigSource");
    }

    @Override
    public String getType() {
        return "local";
    }
}
