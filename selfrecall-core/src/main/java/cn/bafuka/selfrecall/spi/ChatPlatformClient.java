package cn.bafuka.selfrecall.spi;

import cn.bafuka.selfrecall.core.BotRole;
import cn.bafuka.selfrecall.core.DeletableHandle;
import cn.bafuka.selfrecall.core.SessionId;

import java.util.Optional;

/**
 * 聊天平台 SPI 接口
 * 由宿主框架实现，负责发送、删除消息以及查询机器人在群内的身份
 */
public interface ChatPlatformClient {

    /**
     * 发送消息
     *
     * @param session 会话
     * @param content 消息内容
     * @return 可撤回的句柄；平台拿不到真实消息 ID 时返回 empty，不能返回伪造的 ID
     */
    Optional<DeletableHandle> sendMessage(SessionId session, String content);

    /**
     * 删除（撤回）消息
     * 对已删除的消息重复调用时，平台可以抛出异常，调用方只记录日志
     *
     * @param handle 消息句柄
     */
    void deleteMessage(DeletableHandle handle);

    /**
     * 查询机器人在群内的身份（仅 ROLE_AWARE 模式使用）
     *
     * @param groupId 群号
     * @return 机器人身份
     */
    BotRole getBotRoleInGroup(String groupId);

    /**
     * 平台名称
     *
     * @return 平台标识（如 "aiocqhttp"）
     */
    String getPlatform();
}
