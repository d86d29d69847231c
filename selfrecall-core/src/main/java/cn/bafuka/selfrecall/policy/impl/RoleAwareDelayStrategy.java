package cn.bafuka.selfrecall.policy.impl;

import cn.bafuka.selfrecall.core.BotRole;
import cn.bafuka.selfrecall.core.SessionId;
import cn.bafuka.selfrecall.model.DelayMode;
import cn.bafuka.selfrecall.model.RecallPolicyConfig;
import cn.bafuka.selfrecall.policy.DelayStrategy;
import cn.bafuka.selfrecall.spi.ChatPlatformClient;
import lombok.extern.slf4j.Slf4j;

/**
 * 按机器人在群内的身份区分撤回时间
 * 机器人是群主或管理员时使用 adminRecallTime，否则使用 memberRecallTime；身份查询失败按普通成员处理
 */
@Slf4j
public class RoleAwareDelayStrategy implements DelayStrategy {

    private final ChatPlatformClient platformClient;

    public RoleAwareDelayStrategy(ChatPlatformClient platformClient) {
        this.platformClient = platformClient;
    }

    @Override
    public long groupDelay(SessionId session, RecallPolicyConfig config) {
        BotRole role = lookupRole(session.groupId());
        if (role != null && role.isElevated()) {
            return config.getAdminRecallTime();
        }
        return config.getMemberRecallTime();
    }

    @Override
    public DelayMode mode() {
        return DelayMode.ROLE_AWARE;
    }

    private BotRole lookupRole(String groupId) {
        if (platformClient == null) {
            log.warn("ChatPlatformClient 未配置，按普通成员计算撤回时间: groupId={}", groupId);
            return null;
        }
        try {
            BotRole role = platformClient.getBotRoleInGroup(groupId);
            log.debug("机器人群身份: groupId={}, role={}", groupId, role);
            return role;
        } catch (Exception e) {
            log.warn("查询机器人群身份失败，按普通成员计算: groupId={}, error={}", groupId, e.getMessage());
            return null;
        }
    }
}
