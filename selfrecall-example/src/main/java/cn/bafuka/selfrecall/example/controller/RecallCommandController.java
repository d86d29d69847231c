package cn.bafuka.selfrecall.example.controller;

import cn.bafuka.selfrecall.command.CommandContext;
import cn.bafuka.selfrecall.command.RecallCommandService;
import cn.bafuka.selfrecall.exception.RecallException;
import cn.bafuka.selfrecall.spi.ChatPlatformClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * 撤回命令控制器
 * 对应 /recall、/recall_status、/recall_on、/recall_off 四个命令
 */
@Slf4j
@RestController
@RequestMapping("/api/recall/{chatType}/{chatId}")
public class RecallCommandController {

    @Autowired
    private RecallCommandService commandService;

    @Autowired
    private ChatPlatformClient platformClient;

    /**
     * /recall [时间]
     */
    @PostMapping
    public Map<String, Object> recall(@PathVariable String chatType,
                                      @PathVariable String chatId,
                                      @RequestParam(required = false) Long seconds,
                                      @RequestParam(defaultValue = "false") boolean admin) {
        CommandContext context = context(chatType, chatId, admin);
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);

        if (seconds == null) {
            Duration delay = commandService.showDefault(context);
            String chat = context.getSession().getChatType().getDisplayName();
            result.put("message", chat + "默认撤回时间: " + commandService.formatDelay(delay) + "\n使用 /recall [时间] 设置临时撤回时间");
            return result;
        }

        Duration delay = commandService.setOverride(context, seconds);
        result.put("message", "已设置" + commandService.formatDelay(delay) + "后撤回下一条消息，请发送要撤回的消息");
        return result;
    }

    /**
     * /recall_status
     */
    @GetMapping("/status")
    public Map<String, Object> status(@PathVariable String chatType,
                                      @PathVariable String chatId,
                                      @RequestParam(defaultValue = "false") boolean admin) {
        CommandContext context = context(chatType, chatId, admin);
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("message", commandService.renderStatus(context));
        result.put("data", commandService.getStatus(context));
        return result;
    }

    /**
     * /recall_on
     */
    @PostMapping("/whitelist")
    public Map<String, Object> recallOn(@PathVariable String chatType,
                                        @PathVariable String chatId,
                                        @RequestParam(defaultValue = "false") boolean admin) {
        boolean added = commandService.addToWhitelist(context(chatType, chatId, admin));
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("message", added ? "✅ 已启用本群撤回功能" : "本群已在白名单中");
        return result;
    }

    /**
     * /recall_off
     */
    @DeleteMapping("/whitelist")
    public Map<String, Object> recallOff(@PathVariable String chatType,
                                         @PathVariable String chatId,
                                         @RequestParam(defaultValue = "false") boolean admin) {
        boolean removed = commandService.removeFromWhitelist(context(chatType, chatId, admin));
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("message", removed ? "❌ 已禁用本群撤回功能" : "本群不在白名单中");
        return result;
    }

    @ExceptionHandler(RecallException.class)
    public Map<String, Object> handleRecallException(RecallException e) {
        log.info("撤回命令被拒绝: reason={}, message={}", e.getReason(), e.getMessage());
        Map<String, Object> result = new HashMap<>();
        result.put("success", false);
        result.put("reason", e.getReason());
        result.put("message", e.getMessage());
        return result;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException e) {
        Map<String, Object> result = new HashMap<>();
        result.put("success", false);
        result.put("message", e.getMessage());
        return result;
    }

    private CommandContext context(String chatType, String chatId, boolean admin) {
        return new CommandContext(SessionSupport.toSession(platformClient.getPlatform(), chatType, chatId), admin);
    }
}
