package cn.bafuka.selfrecall.coordinator;

import cn.bafuka.selfrecall.core.DeletableHandle;
import cn.bafuka.selfrecall.core.SessionId;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 消息发送后事件
 * 由宿主框架在机器人发出消息后构造，handle 为空表示发送通道没能拿到可撤回的消息 ID
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutgoingMessageEvent {

    /**
     * 消息所在会话
     */
    private SessionId session;

    /**
     * 消息内容（仅用于日志）
     */
    private String content;

    /**
     * 可撤回的消息句柄
     */
    private DeletableHandle handle;
}
