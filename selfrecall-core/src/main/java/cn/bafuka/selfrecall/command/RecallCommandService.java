package cn.bafuka.selfrecall.command;

import java.time.Duration;

/**
 * 撤回命令服务
 * 对外暴露的命令入口，失败时抛出带原因的 {@link cn.bafuka.selfrecall.exception.RecallException}
 */
public interface RecallCommandService {

    /**
     * 为当前会话的下一条消息设置撤回时间
     *
     * @param context 命令上下文
     * @param amount  撤回时间（秒），范围 [1, maxRecallTime]
     * @return 设置的撤回延迟
     */
    Duration setOverride(CommandContext context, long amount);

    /**
     * 当前会话的默认撤回时间
     *
     * @param context 命令上下文
     * @return 默认撤回延迟
     */
    Duration showDefault(CommandContext context);

    /**
     * 查看撤回状态
     *
     * @param context 命令上下文
     * @return 撤回状态
     */
    RecallStatus getStatus(CommandContext context);

    /**
     * 查看撤回状态（文本）
     *
     * @param context 命令上下文
     * @return 状态文本
     */
    String renderStatus(CommandContext context);

    /**
     * 将当前群加入白名单
     *
     * @param context 命令上下文
     * @return false 表示已在白名单中
     */
    boolean addToWhitelist(CommandContext context);

    /**
     * 将当前群移出白名单
     *
     * @param context 命令上下文
     * @return false 表示不在白名单中
     */
    boolean removeFromWhitelist(CommandContext context);

    /**
     * 按配置的时间单位展示延迟，例如 20秒
     *
     * @param delay 延迟
     * @return 展示文本
     */
    String formatDelay(Duration delay);
}
