package cn.bafuka.selfrecall.command;

import cn.bafuka.selfrecall.core.SessionId;
import lombok.Value;

/**
 * 命令调用上下文
 */
@Value
public class CommandContext {

    /**
     * 命令所在会话
     */
    SessionId session;

    /**
     * 调用者是否为管理员（由宿主框架判定）
     */
    boolean senderAdmin;
}
