package cn.bafuka.selfrecall.command;

import cn.bafuka.selfrecall.core.SessionId;
import cn.bafuka.selfrecall.model.DelayMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * 撤回状态
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecallStatus {

    private SessionId session;

    private boolean privateRecallEnabled;

    private Duration privateRecallTime;

    private boolean groupRecallEnabled;

    private Duration groupRecallTime;

    private DelayMode delayMode;

    /**
     * 白名单群数量，0 表示所有群
     */
    private int whitelistSize;

    /**
     * 当前会话是否会撤回
     */
    private boolean sessionEnabled;

    /**
     * 当前会话的默认撤回时间
     */
    private Duration sessionDefaultDelay;

    /**
     * 当前群是否在白名单中（私聊为 null；白名单为空时为 true）
     */
    private Boolean inWhitelist;

    /**
     * 当前会话待使用的一次性撤回时间
     */
    private Duration pendingOverride;

    /**
     * 进行中的撤回任务数
     */
    private int activeTasks;
}
