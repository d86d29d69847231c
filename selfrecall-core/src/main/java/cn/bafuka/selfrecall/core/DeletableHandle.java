package cn.bafuka.selfrecall.core;

import lombok.NonNull;
import lombok.Value;

/**
 * 可撤回的消息句柄
 * 由发送通道返回，足以在之后请求删除这条消息；平台拿不到真实消息 ID 时不应构造句柄
 */
@Value
public class DeletableHandle {

    /**
     * 消息所在会话
     */
    @NonNull
    SessionId session;

    /**
     * 平台侧的消息 ID
     */
    @NonNull
    String messageId;

    @Override
    public String toString() {
        return session.unifiedOrigin() + "#" + messageId;
    }
}
