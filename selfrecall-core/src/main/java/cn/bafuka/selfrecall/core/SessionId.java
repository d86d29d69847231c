package cn.bafuka.selfrecall.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * 会话标识
 * 由平台、会话类型和会话 ID 唯一确定一个私聊或群聊，作为一次性撤回覆盖的键
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SessionId {

    /**
     * 平台名称（如 aiocqhttp）
     */
    @NonNull
    String platform;

    /**
     * 会话类型
     */
    @NonNull
    ChatType chatType;

    /**
     * 私聊为对方 ID，群聊为群号
     */
    @NonNull
    String chatId;

    public static SessionId privateChat(String platform, String userId) {
        return new SessionId(platform, ChatType.PRIVATE, userId);
    }

    public static SessionId group(String platform, String groupId) {
        return new SessionId(platform, ChatType.GROUP, groupId);
    }

    public static SessionId of(String platform, ChatType chatType, String chatId) {
        return new SessionId(platform, chatType, chatId);
    }

    /**
     * 解析 {@code platform:GroupMessage:id} 形式的会话来源标识
     *
     * @param unifiedOrigin 会话来源标识
     * @return 会话标识
     * @throws IllegalArgumentException 格式不正确时
     */
    public static SessionId parse(String unifiedOrigin) {
        if (unifiedOrigin == null) {
            throw new IllegalArgumentException("unifiedOrigin 不能为空");
        }
        String[] parts = unifiedOrigin.split(":", 3);
        if (parts.length != 3 || parts[0].isEmpty() || parts[2].isEmpty()) {
            throw new IllegalArgumentException("无法解析会话标识: " + unifiedOrigin);
        }
        for (ChatType type : ChatType.values()) {
            if (type.getOriginSegment().equals(parts[1])) {
                return new SessionId(parts[0], type, parts[2]);
            }
        }
        throw new IllegalArgumentException("未知的会话类型: " + parts[1]);
    }

    public boolean isPrivate() {
        return chatType == ChatType.PRIVATE;
    }

    public boolean isGroup() {
        return chatType == ChatType.GROUP;
    }

    /**
     * 群号，私聊返回 null
     */
    public String groupId() {
        return isGroup() ? chatId : null;
    }

    public String unifiedOrigin() {
        return platform + ":" + chatType.getOriginSegment() + ":" + chatId;
    }

    @Override
    public String toString() {
        return unifiedOrigin();
    }
}
