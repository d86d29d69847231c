package cn.bafuka.selfrecall.coordinator;

import cn.bafuka.selfrecall.control.impl.DefaultPolicyConfigManager;
import cn.bafuka.selfrecall.coordinator.impl.DefaultRecallCoordinator;
import cn.bafuka.selfrecall.core.DeletableHandle;
import cn.bafuka.selfrecall.core.SessionId;
import cn.bafuka.selfrecall.model.RecallPolicyConfig;
import cn.bafuka.selfrecall.override.PendingOverrideStore;
import cn.bafuka.selfrecall.override.impl.CaffeinePendingOverrideStore;
import cn.bafuka.selfrecall.policy.DelayStrategy;
import cn.bafuka.selfrecall.policy.impl.DefaultRecallPolicyResolver;
import cn.bafuka.selfrecall.policy.impl.FlatDelayStrategy;
import cn.bafuka.selfrecall.registry.impl.DefaultActionRegistry;
import cn.bafuka.selfrecall.scheduler.RecallScheduler;
import cn.bafuka.selfrecall.scheduler.RecallTask;
import cn.bafuka.selfrecall.scheduler.impl.ExecutorRecallScheduler;
import cn.bafuka.selfrecall.spi.ChatPlatformClient;
import cn.bafuka.selfrecall.spi.RecallConfigSource;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

/**
 * DefaultRecallCoordinator 单元测试
 * 组件使用真实实现，平台接口使用 mock，时间单位为毫秒
 */
public class DefaultRecallCoordinatorTest {

    private static final SessionId PRIVATE = SessionId.privateChat("qq", "10001");

    @Mock
    private ChatPlatformClient platformClient;

    @Mock
    private RecallConfigSource configSource;

    private DefaultPolicyConfigManager configManager;

    private DefaultRecallPolicyResolver policyResolver;

    private PendingOverrideStore overrideStore;

    private DefaultActionRegistry registry;

    private ExecutorRecallScheduler scheduler;

    private DefaultRecallCoordinator coordinator;

    @Before
    public void setUp() {
        MockitoAnnotations.initMocks(this);
        configManager = new DefaultPolicyConfigManager(configSource);
        policyResolver = new DefaultRecallPolicyResolver(configManager,
                Collections.<DelayStrategy>singletonList(new FlatDelayStrategy()), TimeUnit.MILLISECONDS);
        overrideStore = new CaffeinePendingOverrideStore(Duration.ofMinutes(10));
        registry = new DefaultActionRegistry();
        scheduler = new ExecutorRecallScheduler(platformClient, registry, 2, Duration.ofSeconds(5));
        coordinator = new DefaultRecallCoordinator(policyResolver, overrideStore, scheduler, platformClient);
    }

    @After
    public void tearDown() {
        coordinator.shutdown();
    }

    /**
     * 私聊默认时间撤回，删除恰好一次
     */
    @Test
    public void testPrivateMessage_ScheduledWithDefaultDelay() throws Exception {
        DeletableHandle handle = new DeletableHandle(PRIVATE, "m1");

        RecallResult result = coordinator.onOutgoingMessage(event(PRIVATE, handle));

        assertTrue(result.isScheduled());
        assertEquals(Duration.ofMillis(20), result.getDelay());
        assertFalse(result.isOverrideUsed());

        assertEquals(RecallTask.State.DONE, result.getTask().terminationFuture().get(2, TimeUnit.SECONDS));
        verify(platformClient, times(1)).deleteMessage(handle);
        assertEquals(0, registry.size());
    }

    /**
     * 不在白名单中的群不安排撤回
     */
    @Test
    public void testGroupNotInWhitelist_PolicyDisabled() {
        configManager.apply(RecallPolicyConfig.defaults().toBuilder().whitelistedGroup("100").build());
        SessionId group = SessionId.group("qq", "200");

        RecallResult result = coordinator.onOutgoingMessage(event(group, new DeletableHandle(group, "m1")));

        assertEquals(RecallResult.Status.POLICY_DISABLED, result.getStatus());
        assertEquals(0, registry.size());
        verifyNoInteractions(platformClient);
    }

    /**
     * 策略关闭时不消费覆盖
     */
    @Test
    public void testPolicyDisabled_KeepsOverride() {
        configManager.apply(RecallPolicyConfig.defaults().toBuilder().enablePrivateRecall(false).build());
        overrideStore.setOverride(PRIVATE, Duration.ofMillis(5));

        RecallResult result = coordinator.onOutgoingMessage(event(PRIVATE, new DeletableHandle(PRIVATE, "m1")));

        assertEquals(RecallResult.Status.POLICY_DISABLED, result.getStatus());
        assertTrue(overrideStore.peekOverride(PRIVATE).isPresent());
    }

    /**
     * 覆盖只作用于下一条消息
     */
    @Test
    public void testOverride_AppliesToNextMessageOnly() {
        SessionId group = SessionId.group("qq", "100");
        configManager.apply(RecallPolicyConfig.defaults().toBuilder().groupRecallTime(500).build());
        overrideStore.setOverride(group, Duration.ofMillis(5));

        RecallResult first = coordinator.onOutgoingMessage(event(group, new DeletableHandle(group, "m1")));
        RecallResult second = coordinator.onOutgoingMessage(event(group, new DeletableHandle(group, "m2")));

        assertEquals(Duration.ofMillis(5), first.getDelay());
        assertTrue(first.isOverrideUsed());
        assertEquals(Duration.ofMillis(500), second.getDelay());
        assertFalse(second.isOverrideUsed());
    }

    /**
     * 平台没有返回消息 ID：不登记任何任务
     */
    @Test
    public void testSendAndRecall_HandleUnresolved() {
        when(platformClient.sendMessage(PRIVATE, "hello")).thenReturn(Optional.empty());

        RecallResult result = coordinator.sendAndRecall(PRIVATE, "hello");

        assertEquals(RecallResult.Status.HANDLE_UNRESOLVED, result.getStatus());
        assertNull(result.getTask());
        assertEquals(0, registry.size());
        verify(platformClient, never()).deleteMessage(any());
    }

    @Test
    public void testSendAndRecall_Scheduled() throws Exception {
        DeletableHandle handle = new DeletableHandle(PRIVATE, "m9");
        when(platformClient.sendMessage(PRIVATE, "hello")).thenReturn(Optional.of(handle));

        RecallResult result = coordinator.sendAndRecall(PRIVATE, "hello");

        assertTrue(result.isScheduled());
        result.getTask().terminationFuture().get(2, TimeUnit.SECONDS);
        verify(platformClient).deleteMessage(handle);
    }

    /**
     * 发送失败不向调用方抛出异常
     */
    @Test
    public void testSendAndRecall_SendFailure() {
        when(platformClient.sendMessage(PRIVATE, "hello")).thenThrow(new IllegalStateException("offline"));

        RecallResult result = coordinator.sendAndRecall(PRIVATE, "hello");

        assertEquals(RecallResult.Status.FAILED, result.getStatus());
        assertEquals(0, registry.size());
    }

    /**
     * 并发关闭只执行一次
     */
    @Test
    public void testShutdown_ConcurrentCallsRunOnce() throws Exception {
        RecallScheduler countingScheduler = mock(RecallScheduler.class);
        DefaultRecallCoordinator target = new DefaultRecallCoordinator(
                policyResolver, overrideStore, countingScheduler, platformClient);

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    target.shutdown();
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        verify(countingScheduler, times(1)).shutdown();
    }

    /**
     * 关闭后：等待中的任务被取消，覆盖被清空，新消息被拒绝
     */
    @Test
    public void testShutdown() throws Exception {
        configManager.apply(RecallPolicyConfig.defaults().toBuilder().maxRecallTime(10000).privateRecallTime(5000).build());
        RecallResult pending = coordinator.onOutgoingMessage(event(PRIVATE, new DeletableHandle(PRIVATE, "m1")));
        overrideStore.setOverride(SessionId.group("qq", "100"), Duration.ofMillis(5));

        coordinator.shutdown();
        coordinator.shutdown();

        assertEquals(RecallTask.State.CANCELLED, pending.getTask().getState());
        assertEquals(0, registry.size());
        assertEquals(0, overrideStore.size());

        RecallResult late = coordinator.onOutgoingMessage(event(PRIVATE, new DeletableHandle(PRIVATE, "m2")));
        assertEquals(RecallResult.Status.REJECTED, late.getStatus());
        Thread.sleep(50);
        verify(platformClient, never()).deleteMessage(any());
    }

    /**
     * 调度异常不会抛给调用方
     */
    @Test
    public void testUnexpectedFailure_ReportedAsResult() {
        RecallScheduler broken = mock(RecallScheduler.class);
        when(broken.schedule(any(), any())).thenThrow(new IllegalStateException("boom"));
        DefaultRecallCoordinator failing = new DefaultRecallCoordinator(
                policyResolver, overrideStore, broken, platformClient);

        RecallResult result = failing.onOutgoingMessage(event(PRIVATE, new DeletableHandle(PRIVATE, "m1")));

        assertEquals(RecallResult.Status.FAILED, result.getStatus());
    }

    @Test
    public void testMissingSession_HandleUnresolved() {
        RecallResult result = coordinator.onOutgoingMessage(OutgoingMessageEvent.builder().build());

        assertEquals(RecallResult.Status.HANDLE_UNRESOLVED, result.getStatus());
        assertEquals(0, registry.size());
    }

    private static OutgoingMessageEvent event(SessionId session, DeletableHandle handle) {
        return OutgoingMessageEvent.builder()
                .session(session)
                .content("reply")
                .handle(handle)
                .build();
    }
}
