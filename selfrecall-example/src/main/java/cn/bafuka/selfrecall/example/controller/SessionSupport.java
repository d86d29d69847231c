package cn.bafuka.selfrecall.example.controller;

import cn.bafuka.selfrecall.core.SessionId;

/**
 * 路径参数到会话标识的转换
 */
final class SessionSupport {

    private SessionSupport() {
    }

    static SessionId toSession(String platform, String chatType, String chatId) {
        if ("group".equalsIgnoreCase(chatType)) {
            return SessionId.group(platform, chatId);
        }
        if ("private".equalsIgnoreCase(chatType)) {
            return SessionId.privateChat(platform, chatId);
        }
        throw new IllegalArgumentException("chatType 只能是 group 或 private: " + chatType);
    }
}
