package cn.bafuka.selfrecall.autoconfigure;

import cn.bafuka.selfrecall.aspect.AutoRecallAspect;
import cn.bafuka.selfrecall.command.RecallCommandService;
import cn.bafuka.selfrecall.command.impl.DefaultRecallCommandService;
import cn.bafuka.selfrecall.config.SelfRecallProperties;
import cn.bafuka.selfrecall.control.PolicyConfigManager;
import cn.bafuka.selfrecall.control.impl.DefaultPolicyConfigManager;
import cn.bafuka.selfrecall.coordinator.RecallCoordinator;
import cn.bafuka.selfrecall.coordinator.impl.DefaultRecallCoordinator;
import cn.bafuka.selfrecall.override.PendingOverrideStore;
import cn.bafuka.selfrecall.override.impl.CaffeinePendingOverrideStore;
import cn.bafuka.selfrecall.policy.DelayStrategy;
import cn.bafuka.selfrecall.policy.RecallPolicyResolver;
import cn.bafuka.selfrecall.policy.impl.DefaultRecallPolicyResolver;
import cn.bafuka.selfrecall.policy.impl.FlatDelayStrategy;
import cn.bafuka.selfrecall.policy.impl.RoleAwareDelayStrategy;
import cn.bafuka.selfrecall.registry.ActionRegistry;
import cn.bafuka.selfrecall.registry.impl.DefaultActionRegistry;
import cn.bafuka.selfrecall.scheduler.RecallScheduler;
import cn.bafuka.selfrecall.scheduler.impl.ExecutorRecallScheduler;
import cn.bafuka.selfrecall.spel.DefaultSpelExpressionParser;
import cn.bafuka.selfrecall.spel.SpelExpressionParser;
import cn.bafuka.selfrecall.spi.ChatPlatformClient;
import cn.bafuka.selfrecall.spi.RecallConfigSource;
import cn.bafuka.selfrecall.spi.impl.JsonFileConfigSource;
import cn.bafuka.selfrecall.spi.impl.LocalPropertiesConfigSource;
import cn.bafuka.selfrecall.spi.impl.NacosConfigSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

/**
 * SelfRecall 自动配置类
 */
@Slf4j
@Configuration
@EnableAspectJAutoProxy
@EnableConfigurationProperties(SelfRecallProperties.class)
@ConditionalOnProperty(prefix = "self-recall", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SelfRecallAutoConfiguration {

    public SelfRecallAutoConfiguration() {
        log.info("SelfRecall auto-configuration initializing...");
    }

    /**
     * SpEL 表达式解析器
     */
    @Bean
    @ConditionalOnMissingBean
    public SpelExpressionParser selfRecallSpelExpressionParser() {
        return new DefaultSpelExpressionParser();
    }

    /**
     * 本地配置源（默认）
     */
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean(RecallConfigSource.class)
    @ConditionalOnProperty(prefix = "self-recall", name = "config-source", havingValue = "local", matchIfMissing = true)
    public LocalPropertiesConfigSource localPropertiesConfigSource(SelfRecallProperties properties) {
        return new LocalPropertiesConfigSource(properties);
    }

    /**
     * JSON 文件配置源
     */
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean(RecallConfigSource.class)
    @ConditionalOnProperty(prefix = "self-recall", name = "config-source", havingValue = "file")
    public JsonFileConfigSource jsonFileConfigSource(SelfRecallProperties properties) {
        return new JsonFileConfigSource(Paths.get(properties.getConfigFile()), properties.getPolicy());
    }

    /**
     * 策略配置管理器
     */
    @Bean
    @ConditionalOnMissingBean
    public PolicyConfigManager policyConfigManager(RecallConfigSource configSource) {
        DefaultPolicyConfigManager manager = new DefaultPolicyConfigManager(configSource);
        manager.initialize();
        return manager;
    }

    /**
     * 一次性撤回覆盖存储
     */
    @Bean
    @ConditionalOnMissingBean
    public PendingOverrideStore pendingOverrideStore(SelfRecallProperties properties) {
        return new CaffeinePendingOverrideStore(Duration.ofSeconds(properties.getOverrideTtlSeconds()));
    }

    /**
     * 撤回任务登记表
     */
    @Bean
    @ConditionalOnMissingBean
    public ActionRegistry actionRegistry() {
        return new DefaultActionRegistry();
    }

    /**
     * 群聊统一撤回时间
     */
    @Bean
    @ConditionalOnMissingBean(FlatDelayStrategy.class)
    public FlatDelayStrategy flatDelayStrategy() {
        return new FlatDelayStrategy();
    }

    /**
     * 按机器人身份区分的撤回时间
     */
    @Bean
    @ConditionalOnMissingBean(RoleAwareDelayStrategy.class)
    public RoleAwareDelayStrategy roleAwareDelayStrategy(ObjectProvider<ChatPlatformClient> platformClient) {
        return new RoleAwareDelayStrategy(platformClient.getIfAvailable());
    }

    /**
     * 撤回策略判定
     */
    @Bean
    @ConditionalOnMissingBean
    public RecallPolicyResolver recallPolicyResolver(PolicyConfigManager configManager,
                                                     List<DelayStrategy> strategies,
                                                     SelfRecallProperties properties) {
        return new DefaultRecallPolicyResolver(configManager, strategies, properties.getTimeUnit());
    }

    /**
     * 延迟撤回调度器（需要宿主提供 ChatPlatformClient），由协调器负责关闭
     */
    @Bean(destroyMethod = "")
    @ConditionalOnBean(ChatPlatformClient.class)
    @ConditionalOnMissingBean
    public RecallScheduler recallScheduler(ChatPlatformClient platformClient,
                                           ActionRegistry registry,
                                           SelfRecallProperties properties) {
        return new ExecutorRecallScheduler(
                platformClient,
                registry,
                properties.getSchedulerThreads(),
                Duration.ofSeconds(properties.getShutdownTimeoutSeconds())
        );
    }

    /**
     * 撤回协调器，容器关闭时取消所有撤回任务
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnBean(ChatPlatformClient.class)
    @ConditionalOnMissingBean
    public RecallCoordinator recallCoordinator(RecallPolicyResolver policyResolver,
                                               PendingOverrideStore overrideStore,
                                               RecallScheduler scheduler,
                                               ChatPlatformClient platformClient) {
        return new DefaultRecallCoordinator(policyResolver, overrideStore, scheduler, platformClient);
    }

    /**
     * 撤回命令服务
     */
    @Bean
    @ConditionalOnMissingBean
    public RecallCommandService recallCommandService(PolicyConfigManager configManager,
                                                     RecallPolicyResolver policyResolver,
                                                     PendingOverrideStore overrideStore,
                                                     ObjectProvider<RecallScheduler> scheduler,
                                                     SelfRecallProperties properties) {
        return new DefaultRecallCommandService(
                configManager,
                policyResolver,
                overrideStore,
                scheduler.getIfAvailable(),
                properties.getTimeUnit()
        );
    }

    /**
     * AOP 切面
     */
    @Bean
    @ConditionalOnBean(RecallCoordinator.class)
    @ConditionalOnMissingBean
    public AutoRecallAspect autoRecallAspect(SpelExpressionParser spelParser, RecallCoordinator coordinator) {
        return new AutoRecallAspect(spelParser, coordinator);
    }

    /**
     * Nacos 配置源（classpath 中存在 nacos-client 时可用）
     */
    @Configuration
    @ConditionalOnClass(name = "com.alibaba.nacos.api.NacosFactory")
    @ConditionalOnProperty(prefix = "self-recall", name = "config-source", havingValue = "nacos")
    public static class NacosSourceConfiguration {

        @Bean(destroyMethod = "")
        @ConditionalOnMissingBean(RecallConfigSource.class)
        public NacosConfigSource nacosConfigSource(SelfRecallProperties properties) {
            SelfRecallProperties.Nacos nacos = properties.getNacos();
            return new NacosConfigSource(nacos.getServerAddr(), nacos.getNamespace(), nacos.getDataId(), nacos.getGroup());
        }
    }
}
