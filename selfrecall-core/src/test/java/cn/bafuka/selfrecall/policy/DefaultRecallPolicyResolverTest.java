package cn.bafuka.selfrecall.policy;

import cn.bafuka.selfrecall.control.PolicyConfigManager;
import cn.bafuka.selfrecall.core.BotRole;
import cn.bafuka.selfrecall.core.SessionId;
import cn.bafuka.selfrecall.exception.RecallException;
import cn.bafuka.selfrecall.model.DelayMode;
import cn.bafuka.selfrecall.model.RecallPolicyConfig;
import cn.bafuka.selfrecall.policy.impl.DefaultRecallPolicyResolver;
import cn.bafuka.selfrecall.policy.impl.FlatDelayStrategy;
import cn.bafuka.selfrecall.policy.impl.RoleAwareDelayStrategy;
import cn.bafuka.selfrecall.spi.ChatPlatformClient;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

/**
 * DefaultRecallPolicyResolver 单元测试
 * 覆盖私聊/群聊开关、白名单边界以及两种群聊时间策略
 */
public class DefaultRecallPolicyResolverTest {

    private static final SessionId PRIVATE = SessionId.privateChat("qq", "10001");

    private static final SessionId GROUP = SessionId.group("qq", "20001");

    @Mock
    private PolicyConfigManager configManager;

    @Mock
    private ChatPlatformClient platformClient;

    private DefaultRecallPolicyResolver resolver;

    @Before
    public void setUp() {
        MockitoAnnotations.initMocks(this);
        resolver = new DefaultRecallPolicyResolver(
                configManager,
                Arrays.<DelayStrategy>asList(new FlatDelayStrategy(), new RoleAwareDelayStrategy(platformClient)),
                TimeUnit.SECONDS
        );
        when(configManager.getCurrent()).thenReturn(RecallPolicyConfig.defaults());
    }

    /**
     * 默认配置：私聊和所有群都撤回
     */
    @Test
    public void testShouldRecall_Defaults() {
        assertTrue(resolver.shouldRecall(PRIVATE));
        assertTrue(resolver.shouldRecall(GROUP));
        assertEquals(Duration.ofSeconds(20), resolver.resolveDelay(PRIVATE));
        assertEquals(Duration.ofSeconds(30), resolver.resolveDelay(GROUP));
    }

    /**
     * 空白名单表示所有群
     */
    @Test
    public void testShouldRecall_EmptyWhitelistAllowsEveryGroup() {
        assertTrue(resolver.shouldRecall(SessionId.group("qq", "1")));
        assertTrue(resolver.shouldRecall(SessionId.group("qq", "999999")));
    }

    /**
     * 单个群的白名单只放行该群
     */
    @Test
    public void testShouldRecall_SingletonWhitelist() {
        use(RecallPolicyConfig.defaults().toBuilder().whitelistedGroup("20001").build());

        assertTrue(resolver.shouldRecall(GROUP));
        assertFalse(resolver.shouldRecall(SessionId.group("qq", "20002")));
        // 白名单不影响私聊
        assertTrue(resolver.shouldRecall(PRIVATE));
    }

    /**
     * 群聊总开关关闭时白名单不起作用
     */
    @Test
    public void testShouldRecall_GroupDisabled() {
        use(RecallPolicyConfig.defaults().toBuilder()
                .enableGroupRecall(false)
                .whitelistedGroup("20001")
                .build());

        assertFalse(resolver.shouldRecall(GROUP));
        assertTrue(resolver.shouldRecall(PRIVATE));
    }

    @Test
    public void testShouldRecall_PrivateDisabled() {
        use(RecallPolicyConfig.defaults().toBuilder().enablePrivateRecall(false).build());

        assertFalse(resolver.shouldRecall(PRIVATE));
        assertTrue(resolver.shouldRecall(GROUP));
    }

    /**
     * 按身份计算：机器人是管理员或群主时使用管理员时间
     */
    @Test
    public void testResolveDelay_RoleAware() {
        use(RecallPolicyConfig.defaults().toBuilder().delayMode(DelayMode.ROLE_AWARE).build());

        when(platformClient.getBotRoleInGroup("20001")).thenReturn(BotRole.ADMIN);
        assertEquals(Duration.ofSeconds(120), resolver.resolveDelay(GROUP));

        when(platformClient.getBotRoleInGroup("20001")).thenReturn(BotRole.OWNER);
        assertEquals(Duration.ofSeconds(120), resolver.resolveDelay(GROUP));

        when(platformClient.getBotRoleInGroup("20001")).thenReturn(BotRole.MEMBER);
        assertEquals(Duration.ofSeconds(30), resolver.resolveDelay(GROUP));

        // 私聊不查询身份
        assertEquals(Duration.ofSeconds(20), resolver.resolveDelay(PRIVATE));
        verify(platformClient, times(3)).getBotRoleInGroup("20001");
    }

    /**
     * 身份查询失败按普通成员处理
     */
    @Test
    public void testResolveDelay_RoleLookupFailure() {
        use(RecallPolicyConfig.defaults().toBuilder()
                .delayMode(DelayMode.ROLE_AWARE)
                .memberRecallTime(45)
                .build());
        when(platformClient.getBotRoleInGroup(anyString())).thenThrow(new IllegalStateException("timeout"));

        assertEquals(Duration.ofSeconds(45), resolver.resolveDelay(GROUP));
    }

    /**
     * 统一模式不查询身份
     */
    @Test
    public void testResolveDelay_FlatIgnoresRole() {
        resolver.resolveDelay(GROUP);
        verify(platformClient, never()).getBotRoleInGroup(anyString());
    }

    /**
     * 没有注册按身份策略时退回统一时间
     */
    @Test
    public void testResolveDelay_MissingStrategyFallsBackToFlat() {
        DefaultRecallPolicyResolver flatOnly = new DefaultRecallPolicyResolver(
                configManager, Collections.<DelayStrategy>emptyList(), TimeUnit.SECONDS);
        use(RecallPolicyConfig.defaults().toBuilder().delayMode(DelayMode.ROLE_AWARE).build());

        assertEquals(Duration.ofSeconds(30), flatOnly.resolveDelay(GROUP));
    }

    @Test
    public void testValidateDelay_Bounds() {
        assertEquals(Duration.ofSeconds(1), resolver.validateDelay(1));
        assertEquals(Duration.ofSeconds(600), resolver.validateDelay(600));

        assertInvalid(0, "撤回时间必须大于0秒");
        assertInvalid(-5, "撤回时间必须大于0秒");
        assertInvalid(601, "撤回时间不能超过600秒");
    }

    /**
     * 单位为毫秒时换算为毫秒
     */
    @Test
    public void testToDuration_Milliseconds() {
        DefaultRecallPolicyResolver millis = new DefaultRecallPolicyResolver(
                configManager, Collections.<DelayStrategy>singletonList(new FlatDelayStrategy()), TimeUnit.MILLISECONDS);

        assertEquals(Duration.ofMillis(30), millis.resolveDelay(GROUP));
        assertEquals(Duration.ofMillis(5), millis.validateDelay(5));
    }

    private void assertInvalid(long amount, String message) {
        try {
            resolver.validateDelay(amount);
            fail("Expected RecallException for " + amount);
        } catch (RecallException e) {
            assertEquals(RecallException.Reason.INVALID_DELAY, e.getReason());
            assertEquals(message, e.getMessage());
        }
    }

    private void use(RecallPolicyConfig config) {
        when(configManager.getCurrent()).thenReturn(config);
    }
}
