package cn.bafuka.selfrecall.example.platform;

import cn.bafuka.selfrecall.core.BotRole;
import cn.bafuka.selfrecall.core.DeletableHandle;
import cn.bafuka.selfrecall.core.SessionId;
import cn.bafuka.selfrecall.spi.ChatPlatformClient;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存中的模拟聊天平台
 * 发送的消息保存在内存里，撤回即删除；可以模拟平台拿不到消息 ID 的情况
 */
@Slf4j
@Component
public class InMemoryChatPlatformClient implements ChatPlatformClient {

    private static final String PLATFORM = "memory";

    private final AtomicLong messageIds = new AtomicLong(1000);

    /**
     * 已发送且未撤回的消息
     */
    private final Map<String, SentMessage> messages = new ConcurrentHashMap<>();

    /**
     * 机器人在各群的身份
     */
    private final Map<String, BotRole> roles = new ConcurrentHashMap<>();

    /**
     * 为 true 时发送成功但不返回消息 ID
     */
    private volatile boolean withholdMessageIds = false;

    @Override
    public Optional<DeletableHandle> sendMessage(SessionId session, String content) {
        String messageId = String.valueOf(messageIds.incrementAndGet());
        messages.put(messageId, new SentMessage(messageId, session.unifiedOrigin(), content, LocalDateTime.now()));
        log.info("发送消息: session={}, messageId={}, content={}", session, messageId, content);

        if (withholdMessageIds) {
            return Optional.empty();
        }
        return Optional.of(new DeletableHandle(session, messageId));
    }

    @Override
    public void deleteMessage(DeletableHandle handle) {
        SentMessage removed = messages.remove(handle.getMessageId());
        if (removed == null) {
            throw new IllegalStateException("消息不存在或已被撤回: " + handle.getMessageId());
        }
        log.info("撤回消息: session={}, messageId={}", handle.getSession(), handle.getMessageId());
    }

    @Override
    public BotRole getBotRoleInGroup(String groupId) {
        return roles.getOrDefault(groupId, BotRole.MEMBER);
    }

    @Override
    public String getPlatform() {
        return PLATFORM;
    }

    public void setBotRole(String groupId, BotRole role) {
        roles.put(groupId, role);
    }

    public void setWithholdMessageIds(boolean withholdMessageIds) {
        this.withholdMessageIds = withholdMessageIds;
    }

    public List<SentMessage> listMessages() {
        return new ArrayList<>(messages.values());
    }

    /**
     * 已发送的消息
     */
    @Data
    @AllArgsConstructor
    public static class SentMessage {

        private String messageId;

        private String session;

        private String content;

        private LocalDateTime sentAt;
    }
}
