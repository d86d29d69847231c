package cn.bafuka.selfrecall.spi.impl;

import cn.bafuka.selfrecall.exception.RecallException;
import cn.bafuka.selfrecall.model.RecallPolicyConfig;
import cn.bafuka.selfrecall.model.RecallPolicyDocument;
import cn.bafuka.selfrecall.spi.RecallConfigSource;
import com.alibaba.fastjson.JSON;
import com.alibaba.nacos.api.NacosFactory;
import com.alibaba.nacos.api.config.ConfigService;
import com.alibaba.nacos.api.config.listener.Listener;
import com.alibaba.nacos.api.exception.NacosException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Nacos 配置源适配器实现
 * 支持撤回策略热更新，白名单命令通过 publishConfig 写回
 */
@Slf4j
public class NacosConfigSource implements RecallConfigSource {

    private static final long TIMEOUT_MS = 5000;

    /**
     * Nacos 服务地址
     */
    private final String serverAddr;

    /**
     * Nacos 命名空间
     */
    private final String namespace;

    /**
     * Nacos DataId
     */
    private final String dataId;

    /**
     * Nacos Group
     */
    private final String group;

    /**
     * Nacos ConfigService
     */
    private volatile ConfigService configService;

    /**
     * 配置监听器
     */
    private volatile Consumer<RecallPolicyConfig> listener;

    /**
     * Nacos 内部监听器
     */
    private NacosListener nacosListener;

    public NacosConfigSource(String serverAddr, String namespace, String dataId, String group) {
        this.serverAddr = serverAddr;
        this.namespace = namespace;
        this.dataId = dataId;
        this.group = group;
    }

    /**
     * 使用已有的 ConfigService（测试或宿主自行管理连接时）
     */
    public NacosConfigSource(ConfigService configService, String dataId, String group) {
        this(null, null, dataId, group);
        this.configService = configService;
    }

    @Override
    public void subscribe(Consumer<RecallPolicyConfig> listener) {
        this.listener = listener;

        try {
            ConfigService service = obtainConfigService();

            // 初次加载配置，尚未发布内容时使用默认策略
            String config = service.getConfig(dataId, group, TIMEOUT_MS);
            if (config == null || config.trim().isEmpty()) {
                log.warn("Nacos 中没有撤回策略，使用默认策略: dataId={}, group={}", dataId, group);
                if (listener != null) {
                    listener.accept(new RecallPolicyDocument().toConfig());
                }
            } else {
                handleConfigChange(config);
            }

            // 添加监听器
            nacosListener = new NacosListener();
            service.addListener(dataId, group, nacosListener);

            log.info("Subscribed to Nacos config: serverAddr={}, namespace={}, dataId={}, group={}",
                    serverAddr, namespace, dataId, group);

        } catch (NacosException e) {
            log.error("失败: subscribe to Nacos config", e);
            throw new RecallException(RecallException.Reason.CONFIG_ERROR,
                    "Failed to subscribe to Nacos config", e);
        }
    }

    @Override
    public RecallPolicyConfig getCurrentConfig() {
        return fetchDocument().toConfig();
    }

    @Override
    public synchronized void saveWhitelist(Set<String> groupWhitelist) {
        RecallPolicyDocument document = fetchDocument();
        document.setGroupWhitelist(new ArrayList<>(groupWhitelist));

        boolean published;
        try {
            published = obtainConfigService().publishConfig(dataId, group, JSON.toJSONString(document));
        } catch (NacosException e) {
            throw new RecallException(RecallException.Reason.CONFIG_ERROR,
                    "白名单写回 Nacos 失败", e);
        }
        if (!published) {
            throw new RecallException(RecallException.Reason.CONFIG_ERROR,
                    "Nacos 拒绝了白名单写回: dataId=" + dataId);
        }
        log.info("白名单已写回 Nacos: dataId={}, size={}", dataId, groupWhitelist.size());
    }

    @Override
    public void shutdown() {
        if (configService != null && nacosListener != null) {
            try {
                configService.removeListener(dataId, group, nacosListener);
                log.info("已关闭 NacosConfigSource");
            } catch (Exception e) {
                log.error("失败: remove Nacos listener", e);
            }
        }
        listener = null;
    }

    @Override
    public String getType() {
        return "nacos";
    }

    private ConfigService obtainConfigService() throws NacosException {
        if (configService == null) {
            synchronized (this) {
                if (configService == null) {
                    Properties properties = new Properties();
                    properties.put("serverAddr", serverAddr);
                    if (namespace != null && !namespace.isEmpty()) {
                        properties.put("namespace", namespace);
                    }
                    configService = NacosFactory.createConfigService(properties);
                }
            }
        }
        return configService;
    }

    private RecallPolicyDocument fetchDocument() {
        try {
            String config = obtainConfigService().getConfig(dataId, group, TIMEOUT_MS);
            return parseConfig(config);
        } catch (NacosException e) {
            throw new RecallException(RecallException.Reason.CONFIG_ERROR,
                    "从 Nacos 读取撤回策略失败", e);
        }
    }

    /**
     * 处理配置变更
     *
     * @param config 配置内容
     */
    private void handleConfigChange(String config) {
        if (config == null || config.trim().isEmpty()) {
            log.warn("Received empty config from Nacos, keep current policy");
            return;
        }

        try {
            RecallPolicyConfig policy = parseConfig(config).toConfig();
            Consumer<RecallPolicyConfig> current = listener;
            if (current != null) {
                current.accept(policy);
            }
        } catch (Exception e) {
            log.error("失败: handle config change: {}", config, e);
        }
    }

    /**
     * 解析配置
     *
     * @param config JSON 配置字符串
     * @return 策略文档，内容为空时返回默认值
     */
    private RecallPolicyDocument parseConfig(String config) {
        if (config == null || config.trim().isEmpty()) {
            return new RecallPolicyDocument();
        }
        RecallPolicyDocument document = JSON.parseObject(config, RecallPolicyDocument.class);
        return document != null ? document : new RecallPolicyDocument();
    }

    /**
     * Nacos 监听器实现
     */
    private class NacosListener implements Listener {

        @Override
        public void receiveConfigInfo(String configInfo) {
            log.info("Received config change from Nacos, length={}", configInfo != null ? configInfo.length() : 0);
            handleConfigChange(configInfo);
        }

        @Override
        public Executor getExecutor() {
            // 返回 null 使用默认线程池
            return null;
        }
    }
}
