package cn.bafuka.selfrecall.example.controller;

import cn.bafuka.selfrecall.core.BotRole;
import cn.bafuka.selfrecall.core.DeletableHandle;
import cn.bafuka.selfrecall.core.SessionId;
import cn.bafuka.selfrecall.example.platform.InMemoryChatPlatformClient;
import cn.bafuka.selfrecall.example.service.BotMessageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 聊天控制器
 * 模拟机器人发消息，并查看模拟平台上仍存在的消息
 */
@Slf4j
@RestController
@RequestMapping("/api/chat")
public class ChatController {

    @Autowired
    private BotMessageService botMessageService;

    @Autowired
    private InMemoryChatPlatformClient platformClient;

    /**
     * 机器人发送消息
     */
    @PostMapping("/{chatType}/{chatId}/send")
    public Map<String, Object> send(@PathVariable String chatType,
                                    @PathVariable String chatId,
                                    @RequestParam String text) {
        SessionId session = SessionSupport.toSession(platformClient.getPlatform(), chatType, chatId);
        Optional<DeletableHandle> handle = botMessageService.reply(session, text);

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("session", session.unifiedOrigin());
        result.put("messageId", handle.map(DeletableHandle::getMessageId).orElse(null));
        return result;
    }

    /**
     * 查看未撤回的消息
     */
    @GetMapping("/messages")
    public Map<String, Object> messages() {
        List<InMemoryChatPlatformClient.SentMessage> messages = platformClient.listMessages();
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("data", messages);
        result.put("total", messages.size());
        return result;
    }

    /**
     * 设置机器人在群内的身份
     */
    @PutMapping("/group/{groupId}/role")
    public Map<String, Object> setRole(@PathVariable String groupId, @RequestParam BotRole role) {
        platformClient.setBotRole(groupId, role);
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("message", "机器人身份已更新");
        return result;
    }

    /**
     * 模拟平台不返回消息 ID
     */
    @PutMapping("/withhold-ids")
    public Map<String, Object> withholdIds(@RequestParam boolean enabled) {
        platformClient.setWithholdMessageIds(enabled);
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("withholdMessageIds", enabled);
        return result;
    }
}
