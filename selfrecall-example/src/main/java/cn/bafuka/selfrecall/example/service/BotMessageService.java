package cn.bafuka.selfrecall.example.service;

import cn.bafuka.selfrecall.annotation.AutoRecall;
import cn.bafuka.selfrecall.core.DeletableHandle;
import cn.bafuka.selfrecall.core.SessionId;
import cn.bafuka.selfrecall.spi.ChatPlatformClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 机器人消息服务
 * 演示 @AutoRecall 的使用
 */
@Slf4j
@Service
public class BotMessageService {

    @Autowired
    private ChatPlatformClient platformClient;

    /**
     * 发送消息，返回后按撤回策略安排撤回
     *
     * @param session 会话
     * @param text    消息内容
     * @return 消息句柄
     */
    @AutoRecall(session = "#session", condition = "#text != null && !#text.isEmpty()")
    public Optional<DeletableHandle> reply(SessionId session, String text) {
        return platformClient.sendMessage(session, text);
    }
}
