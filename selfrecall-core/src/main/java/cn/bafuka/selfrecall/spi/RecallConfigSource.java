package cn.bafuka.selfrecall.spi;

import cn.bafuka.selfrecall.model.RecallPolicyConfig;

import java.util.Set;
import java.util.function.Consumer;

/**
 * 撤回策略配置源 SPI 接口
 * 用于对接不同的配置存储（Spring 配置、本地 JSON 文件、Nacos 等）
 */
public interface RecallConfigSource {

    /**
     * 订阅配置变更
     * 订阅时会立即推送一次当前配置
     *
     * @param listener 配置变更监听器
     */
    void subscribe(Consumer<RecallPolicyConfig> listener);

    /**
     * 获取当前配置（同步方式）
     *
     * @return 当前的策略配置
     */
    RecallPolicyConfig getCurrentConfig();

    /**
     * 写回群聊白名单
     *
     * @param groupWhitelist 新的白名单
     */
    void saveWhitelist(Set<String> groupWhitelist);

    /**
     * 停止订阅
     */
    void shutdown();

    /**
     * 配置源类型标识
     *
     * @return 类型名称（如 "local", "file", "nacos"）
     */
    String getType();
}
