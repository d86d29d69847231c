package cn.bafuka.selfrecall.coordinator.impl;

import cn.bafuka.selfrecall.coordinator.OutgoingMessageEvent;
import cn.bafuka.selfrecall.coordinator.RecallCoordinator;
import cn.bafuka.selfrecall.coordinator.RecallResult;
import cn.bafuka.selfrecall.core.DeletableHandle;
import cn.bafuka.selfrecall.core.SessionId;
import cn.bafuka.selfrecall.override.PendingOverrideStore;
import cn.bafuka.selfrecall.policy.RecallPolicyResolver;
import cn.bafuka.selfrecall.scheduler.RecallScheduler;
import cn.bafuka.selfrecall.scheduler.RecallTask;
import cn.bafuka.selfrecall.spi.ChatPlatformClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 撤回协调器默认实现
 */
@Slf4j
public class DefaultRecallCoordinator implements RecallCoordinator {

    private final RecallPolicyResolver policyResolver;

    private final PendingOverrideStore overrideStore;

    private final RecallScheduler scheduler;

    private final ChatPlatformClient platformClient;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public DefaultRecallCoordinator(RecallPolicyResolver policyResolver,
                                    PendingOverrideStore overrideStore,
                                    RecallScheduler scheduler,
                                    ChatPlatformClient platformClient) {
        this.policyResolver = policyResolver;
        this.overrideStore = overrideStore;
        this.scheduler = scheduler;
        this.platformClient = platformClient;
    }

    @Override
    public RecallResult onOutgoingMessage(OutgoingMessageEvent event) {
        SessionId session = event.getSession();
        if (session == null) {
            log.warn("消息事件缺少会话信息，跳过撤回");
            return RecallResult.handleUnresolved(null, null, false);
        }

        try {
            // 1. 策略判定
            if (!policyResolver.shouldRecall(session)) {
                log.debug("会话未启用撤回: session={}", session);
                return RecallResult.policyDisabled(session);
            }

            // 2. 一次性覆盖优先，否则使用默认延迟
            Optional<Duration> override = overrideStore.takeOverride(session);
            Duration delay = override.isPresent() ? override.get() : policyResolver.resolveDelay(session);

            // 3. 取得消息句柄，拿不到时不猜测 ID
            DeletableHandle handle = event.getHandle();
            if (handle == null) {
                log.warn("无法获取消息句柄，跳过撤回: session={}, overrideUsed={}", session, override.isPresent());
                return RecallResult.handleUnresolved(session, delay, override.isPresent());
            }

            // 4. 安排撤回
            RecallTask task = scheduler.schedule(handle, delay);
            if (task.getState() == RecallTask.State.CANCELLED) {
                return RecallResult.rejected(session, delay, override.isPresent(), task);
            }

            log.info("{}消息已安排{}后撤回: handle={}, overrideUsed={}",
                    session.getChatType().getDisplayName(), delay, handle, override.isPresent());
            return RecallResult.scheduled(session, delay, override.isPresent(), task);

        } catch (Exception e) {
            log.error("消息撤回处理失败: session={}", session, e);
            return RecallResult.failed(session);
        }
    }

    @Override
    public RecallResult sendAndRecall(SessionId session, String content) {
        Optional<DeletableHandle> handle;
        try {
            handle = platformClient.sendMessage(session, content);
        } catch (Exception e) {
            log.error("消息发送失败，未安排撤回: session={}", session, e);
            return RecallResult.failed(session);
        }
        return onOutgoingMessage(OutgoingMessageEvent.builder()
                .session(session)
                .content(content)
                .handle(handle.orElse(null))
                .build());
    }

    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }

        log.info("关闭撤回协调器...");
        scheduler.shutdown();
        overrideStore.clear();
        log.info("自动撤回已关闭");
    }
}
