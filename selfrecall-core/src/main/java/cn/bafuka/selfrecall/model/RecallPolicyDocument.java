package cn.bafuka.selfrecall.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 撤回策略的可持久化形式
 * 同时用于 Spring 属性绑定和 JSON 配置文件 / Nacos 配置内容
 */
@Data
public class RecallPolicyDocument {

    private boolean enablePrivateRecall = true;

    private boolean enableGroupRecall = true;

    private List<String> groupWhitelist = new ArrayList<>();

    private long privateRecallTime = 20;

    private long groupRecallTime = 30;

    private long adminRecallTime = 120;

    private long memberRecallTime = 30;

    private long maxRecallTime = 600;

    private boolean adminOnly = true;

    private DelayMode delayMode = DelayMode.FLAT;

    public RecallPolicyConfig toConfig() {
        RecallPolicyConfig.RecallPolicyConfigBuilder builder = RecallPolicyConfig.builder()
                .enablePrivateRecall(enablePrivateRecall)
                .enableGroupRecall(enableGroupRecall)
                .privateRecallTime(privateRecallTime)
                .groupRecallTime(groupRecallTime)
                .adminRecallTime(adminRecallTime)
                .memberRecallTime(memberRecallTime)
                .maxRecallTime(maxRecallTime)
                .adminOnly(adminOnly)
                .delayMode(delayMode);
        if (groupWhitelist != null) {
            for (String groupId : groupWhitelist) {
                builder.whitelistedGroup(groupId == null ? null : groupId.trim());
            }
        }
        return builder.build();
    }

    public static RecallPolicyDocument from(RecallPolicyConfig config) {
        RecallPolicyDocument document = new RecallPolicyDocument();
        document.setEnablePrivateRecall(config.isEnablePrivateRecall());
        document.setEnableGroupRecall(config.isEnableGroupRecall());
        document.setGroupWhitelist(new ArrayList<>(config.getGroupWhitelist()));
        document.setPrivateRecallTime(config.getPrivateRecallTime());
        document.setGroupRecallTime(config.getGroupRecallTime());
        document.setAdminRecallTime(config.getAdminRecallTime());
        document.setMemberRecallTime(config.getMemberRecallTime());
        document.setMaxRecallTime(config.getMaxRecallTime());
        document.setAdminOnly(config.isAdminOnly());
        document.setDelayMode(config.getDelayMode());
        return document;
    }
}
