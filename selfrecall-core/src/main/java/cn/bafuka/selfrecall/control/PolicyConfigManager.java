package cn.bafuka.selfrecall.control;

import cn.bafuka.selfrecall.model.RecallPolicyConfig;

/**
 * 策略配置管理器接口
 * 持有当前生效的策略快照，负责校验、热更新和白名单写回
 */
public interface PolicyConfigManager {

    /**
     * 初始化：订阅配置源
     *
     * @throws cn.bafuka.selfrecall.exception.RecallException 配置源没有推送合法配置时（CONFIG_ERROR）
     */
    void initialize();

    /**
     * 当前生效的配置快照
     *
     * @return 配置快照，永不为 null
     */
    RecallPolicyConfig getCurrent();

    /**
     * 应用新的配置快照
     * 校验失败时保留旧配置
     *
     * @param config 新配置
     * @return true 表示已生效
     */
    boolean apply(RecallPolicyConfig config);

    /**
     * 将群加入白名单
     *
     * @param groupId 群号
     * @return false 表示已在白名单中，未做修改
     */
    boolean addToWhitelist(String groupId);

    /**
     * 将群移出白名单
     *
     * @param groupId 群号
     * @return false 表示不在白名单中，未做修改
     */
    boolean removeFromWhitelist(String groupId);

    /**
     * 关闭管理器
     */
    void shutdown();
}
