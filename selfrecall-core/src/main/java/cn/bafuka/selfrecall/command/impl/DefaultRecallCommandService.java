package cn.bafuka.selfrecall.command.impl;

import cn.bafuka.selfrecall.command.CommandContext;
import cn.bafuka.selfrecall.command.RecallCommandService;
import cn.bafuka.selfrecall.command.RecallStatus;
import cn.bafuka.selfrecall.control.PolicyConfigManager;
import cn.bafuka.selfrecall.core.SessionId;
import cn.bafuka.selfrecall.exception.RecallException;
import cn.bafuka.selfrecall.model.DelayMode;
import cn.bafuka.selfrecall.model.RecallPolicyConfig;
import cn.bafuka.selfrecall.override.PendingOverrideStore;
import cn.bafuka.selfrecall.policy.RecallPolicyResolver;
import cn.bafuka.selfrecall.scheduler.RecallScheduler;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 撤回命令服务默认实现
 */
@Slf4j
public class DefaultRecallCommandService implements RecallCommandService {

    private final PolicyConfigManager configManager;

    private final RecallPolicyResolver policyResolver;

    private final PendingOverrideStore overrideStore;

    /**
     * 可为 null，此时状态中的进行中任务数为 0
     */
    private final RecallScheduler scheduler;

    /**
     * 撤回时间的展示单位
     */
    private final TimeUnit timeUnit;

    public DefaultRecallCommandService(PolicyConfigManager configManager,
                                       RecallPolicyResolver policyResolver,
                                       PendingOverrideStore overrideStore,
                                       RecallScheduler scheduler,
                                       TimeUnit timeUnit) {
        this.configManager = configManager;
        this.policyResolver = policyResolver;
        this.overrideStore = overrideStore;
        this.scheduler = scheduler;
        this.timeUnit = timeUnit;
    }

    @Override
    public Duration setOverride(CommandContext context, long amount) {
        checkPermission(context, "权限不足，只有管理员可以设置撤回时间");
        ensureEnabled(context.getSession());

        Duration delay = policyResolver.validateDelay(amount);
        overrideStore.setOverride(context.getSession(), delay);
        log.info("已设置下一条消息的撤回时间: session={}, delay={}", context.getSession(), delay);
        return delay;
    }

    @Override
    public Duration showDefault(CommandContext context) {
        checkPermission(context, "权限不足，只有管理员可以设置撤回时间");
        ensureEnabled(context.getSession());
        return policyResolver.resolveDelay(context.getSession());
    }

    @Override
    public RecallStatus getStatus(CommandContext context) {
        checkPermission(context, "权限不足");

        SessionId session = context.getSession();
        RecallPolicyConfig config = configManager.getCurrent();

        Boolean inWhitelist = session.isGroup() ? config.isGroupAllowed(session.groupId()) : null;

        return RecallStatus.builder()
                .session(session)
                .privateRecallEnabled(config.isEnablePrivateRecall())
                .privateRecallTime(policyResolver.toDuration(config.getPrivateRecallTime()))
                .groupRecallEnabled(config.isEnableGroupRecall())
                .groupRecallTime(policyResolver.toDuration(config.getGroupRecallTime()))
                .delayMode(config.getDelayMode())
                .whitelistSize(config.getGroupWhitelist().size())
                .sessionEnabled(policyResolver.shouldRecall(session))
                .sessionDefaultDelay(policyResolver.resolveDelay(session))
                .inWhitelist(inWhitelist)
                .pendingOverride(overrideStore.peekOverride(session).orElse(null))
                .activeTasks(scheduler != null ? scheduler.activeCount() : 0)
                .build();
    }

    @Override
    public String renderStatus(CommandContext context) {
        RecallStatus status = getStatus(context);
        RecallPolicyConfig config = configManager.getCurrent();

        StringBuilder text = new StringBuilder();
        text.append("私聊撤回: ").append(enabledMark(status.isPrivateRecallEnabled()))
                .append(" (").append(formatDelay(status.getPrivateRecallTime())).append(")\n");

        text.append("群聊撤回: ").append(enabledMark(status.isGroupRecallEnabled()));
        if (status.getDelayMode() == DelayMode.ROLE_AWARE) {
            text.append(" (管理员").append(formatDelay(policyResolver.toDuration(config.getAdminRecallTime())))
                    .append("/成员").append(formatDelay(policyResolver.toDuration(config.getMemberRecallTime())))
                    .append(")\n");
        } else {
            text.append(" (").append(formatDelay(status.getGroupRecallTime())).append(")\n");
        }

        if (status.isGroupRecallEnabled()) {
            if (status.getWhitelistSize() > 0) {
                text.append("白名单群聊: ").append(status.getWhitelistSize()).append("个\n");
            } else {
                text.append("白名单群聊: 所有群聊\n");
            }
        }

        SessionId session = status.getSession();
        if (session.isPrivate()) {
            text.append("当前会话: 私聊 (默认").append(formatDelay(status.getSessionDefaultDelay())).append("后撤回)");
        } else {
            text.append("当前会话: 群聊").append(session.groupId())
                    .append(" (默认").append(formatDelay(status.getSessionDefaultDelay())).append("后撤回)");
            if (status.isGroupRecallEnabled() && Boolean.FALSE.equals(status.getInWhitelist())) {
                text.append(" ❌不在白名单中");
            }
        }

        if (status.getPendingOverride() != null) {
            text.append("\n下次消息撤回: ").append(formatDelay(status.getPendingOverride())).append("后");
        }

        return text.toString();
    }

    @Override
    public boolean addToWhitelist(CommandContext context) {
        String groupId = requireGroup(context);
        checkPermission(context, "权限不足");
        return configManager.addToWhitelist(groupId);
    }

    @Override
    public boolean removeFromWhitelist(CommandContext context) {
        String groupId = requireGroup(context);
        checkPermission(context, "权限不足");
        return configManager.removeFromWhitelist(groupId);
    }

    private void checkPermission(CommandContext context, String message) {
        if (configManager.getCurrent().isAdminOnly() && !context.isSenderAdmin()) {
            throw new RecallException(RecallException.Reason.PERMISSION_DENIED, message);
        }
    }

    private void ensureEnabled(SessionId session) {
        if (!policyResolver.shouldRecall(session)) {
            throw new RecallException(RecallException.Reason.POLICY_DISABLED,
                    session.isPrivate() ? "私聊撤回功能未启用" : "本群未启用撤回功能");
        }
    }

    private String requireGroup(CommandContext context) {
        if (!context.getSession().isGroup()) {
            throw new RecallException(RecallException.Reason.GROUP_ONLY, "此命令仅在群聊中可用");
        }
        return context.getSession().groupId();
    }

    private static String enabledMark(boolean enabled) {
        return enabled ? "✅已启用" : "❌已禁用";
    }

    @Override
    public String formatDelay(Duration duration) {
        long amount = timeUnit.convert(duration.toNanos(), TimeUnit.NANOSECONDS);
        return amount + unitName();
    }

    private String unitName() {
        switch (timeUnit) {
            case MILLISECONDS:
                return "毫秒";
            case MINUTES:
                return "分钟";
            case HOURS:
                return "小时";
            case SECONDS:
                return "秒";
            default:
                return timeUnit.name().toLowerCase();
        }
    }
}
