package cn.bafuka.selfrecall.spi.impl;

import cn.bafuka.selfrecall.exception.RecallException;
import cn.bafuka.selfrecall.model.RecallPolicyConfig;
import cn.bafuka.selfrecall.model.RecallPolicyDocument;
import cn.bafuka.selfrecall.spi.RecallConfigSource;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.serializer.SerializerFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Set;
import java.util.function.Consumer;

/**
 * JSON 文件配置源实现
 * 撤回策略保存在本地 JSON 文件中，白名单命令会写回文件；文件不存在时用初始配置创建
 */
@Slf4j
public class JsonFileConfigSource implements RecallConfigSource {

    /**
     * 配置文件路径
     */
    private final Path file;

    /**
     * 文件不存在时写入的初始内容
     */
    private final RecallPolicyDocument initialDocument;

    /**
     * 配置监听器
     */
    private volatile Consumer<RecallPolicyConfig> listener;

    public JsonFileConfigSource(Path file, RecallPolicyDocument initialDocument) {
        this.file = file;
        this.initialDocument = initialDocument != null ? initialDocument : new RecallPolicyDocument();
    }

    @Override
    public void subscribe(Consumer<RecallPolicyConfig> listener) {
        this.listener = listener;
        RecallPolicyConfig config = getCurrentConfig();
        if (listener != null) {
            listener.accept(config);
        }
        log.info("已加载撤回策略 from file: {}", file.toAbsolutePath());
    }

    @Override
    public synchronized RecallPolicyConfig getCurrentConfig() {
        return readDocument().toConfig();
    }

    /**
     * 重新读取配置文件并通知监听器（文件被外部修改后调用）
     */
    public void reload() {
        RecallPolicyConfig config = getCurrentConfig();
        Consumer<RecallPolicyConfig> current = listener;
        if (current != null) {
            current.accept(config);
        }
        log.info("撤回策略已重新加载: file={}", file);
    }

    @Override
    public synchronized void saveWhitelist(Set<String> groupWhitelist) {
        RecallPolicyDocument document = readDocument();
        document.setGroupWhitelist(new ArrayList<>(groupWhitelist));
        writeDocument(document);
        log.info("白名单已写回配置文件: file={}, size={}", file, groupWhitelist.size());
    }

    @Override
    public void shutdown() {
        log.info("关闭 JsonFileConfigSource");
        listener = null;
    }

    @Override
    public String getType() {
        return "file";
    }

    private RecallPolicyDocument readDocument() {
        if (!Files.exists(file)) {
            log.info("配置文件不存在，使用初始配置创建: {}", file);
            writeDocument(initialDocument);
            return copyOf(initialDocument);
        }

        try {
            String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            if (text.trim().isEmpty()) {
                return copyOf(initialDocument);
            }
            RecallPolicyDocument document = JSON.parseObject(text, RecallPolicyDocument.class);
            return document != null ? document : copyOf(initialDocument);
        } catch (IOException e) {
            throw new RecallException(RecallException.Reason.CONFIG_ERROR,
                    "读取配置文件失败: " + file, e);
        } catch (RuntimeException e) {
            throw new RecallException(RecallException.Reason.CONFIG_ERROR,
                    "解析配置文件失败: " + file, e);
        }
    }

    private void writeDocument(RecallPolicyDocument document) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            String text = JSON.toJSONString(document, SerializerFeature.PrettyFormat);
            Files.write(tmp, text.getBytes(StandardCharsets.UTF_8));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new RecallException(RecallException.Reason.CONFIG_ERROR,
                    "写入配置文件失败: " + file, e);
        }
    }

    private static RecallPolicyDocument copyOf(RecallPolicyDocument document) {
        return JSON.parseObject(JSON.toJSONString(document), RecallPolicyDocument.class);
    }
}
