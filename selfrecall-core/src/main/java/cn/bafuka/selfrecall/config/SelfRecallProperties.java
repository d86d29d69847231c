package cn.bafuka.selfrecall.config;

import cn.bafuka.selfrecall.model.RecallPolicyDocument;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.util.concurrent.TimeUnit;

/**
 * SelfRecall 配置属性
 * 从 application.yml 读取配置
 */
@Data
@ConfigurationProperties(prefix = "self-recall")
public class SelfRecallProperties {

    /**
     * 是否启用 SelfRecall
     */
    private boolean enabled = true;

    /**
     * 撤回策略（config-source 为 local 时直接生效，为 file 时作为初始内容）
     */
    @NestedConfigurationProperty
    private RecallPolicyDocument policy = new RecallPolicyDocument();

    /**
     * 配置源类型：local / file / nacos
     */
    private String configSource = "local";

    /**
     * JSON 配置文件路径（config-source 为 file 时使用）
     */
    private String configFile = "self-recall.json";

    /**
     * Nacos 配置（config-source 为 nacos 时使用）
     */
    private Nacos nacos = new Nacos();

    /**
     * 一次性撤回覆盖的过期时间（秒），0 表示不过期
     */
    private long overrideTtlSeconds = 3600;

    /**
     * 撤回时间的单位，默认秒
     */
    private TimeUnit timeUnit = TimeUnit.SECONDS;

    /**
     * 撤回调度线程数
     */
    private int schedulerThreads = 2;

    /**
     * 关闭时等待撤回任务结束的超时时间（秒）
     */
    private long shutdownTimeoutSeconds = 30;

    /**
     * Nacos 配置
     */
    @Data
    public static class Nacos {

        private String serverAddr = "127.0.0.1:8848";

        private String namespace;

        private String dataId = "self-recall.json";

        private String group = "DEFAULT_GROUP";
    }
}
