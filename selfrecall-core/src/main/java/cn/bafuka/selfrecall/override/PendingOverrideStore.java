package cn.bafuka.selfrecall.override;

import cn.bafuka.selfrecall.core.SessionId;

import java.time.Duration;
import java.util.Optional;

/**
 * 一次性撤回覆盖存储
 * 每个会话最多一条，由命令写入，被该会话的下一条消息读取并删除
 */
public interface PendingOverrideStore {

    /**
     * 设置覆盖，已有的覆盖会被替换
     *
     * @param session 会话
     * @param delay   撤回延迟
     */
    void setOverride(SessionId session, Duration delay);

    /**
     * 原子地读取并删除覆盖
     * 同一会话并发调用时，至多一个调用方拿到值
     *
     * @param session 会话
     * @return 覆盖的延迟，不存在时返回 empty
     */
    Optional<Duration> takeOverride(SessionId session);

    /**
     * 查看覆盖但不消费（状态展示用）
     *
     * @param session 会话
     * @return 覆盖的延迟
     */
    Optional<Duration> peekOverride(SessionId session);

    /**
     * 清空所有覆盖
     */
    void clear();

    /**
     * 当前覆盖数量
     */
    long size();
}
