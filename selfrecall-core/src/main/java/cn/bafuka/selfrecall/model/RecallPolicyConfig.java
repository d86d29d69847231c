package cn.bafuka.selfrecall.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * 撤回策略配置快照
 * 每次判定时读取的不可变视图；修改白名单会生成新的快照
 */
@Value
@Builder(toBuilder = true)
public class RecallPolicyConfig {

    /**
     * 是否启用私聊撤回
     */
    @Builder.Default
    boolean enablePrivateRecall = true;

    /**
     * 是否启用群聊撤回
     */
    @Builder.Default
    boolean enableGroupRecall = true;

    /**
     * 群聊白名单，为空表示不限制（所有群都允许）
     */
    @Singular("whitelistedGroup")
    Set<String> groupWhitelist;

    /**
     * 私聊默认撤回时间
     */
    @Builder.Default
    long privateRecallTime = 20;

    /**
     * 群聊默认撤回时间（FLAT 模式）
     */
    @Builder.Default
    long groupRecallTime = 30;

    /**
     * 机器人为群管理时的撤回时间（ROLE_AWARE 模式）
     */
    @Builder.Default
    long adminRecallTime = 120;

    /**
     * 机器人为普通成员时的撤回时间（ROLE_AWARE 模式）
     */
    @Builder.Default
    long memberRecallTime = 30;

    /**
     * 手动设置撤回时间的上限
     */
    @Builder.Default
    long maxRecallTime = 600;

    /**
     * 是否只允许管理员使用撤回命令
     */
    @Builder.Default
    boolean adminOnly = true;

    /**
     * 群聊默认时间的计算方式
     */
    @Builder.Default
    DelayMode delayMode = DelayMode.FLAT;

    public static RecallPolicyConfig defaults() {
        return RecallPolicyConfig.builder().build();
    }

    /**
     * 白名单为空时不做限制；非空时只有名单内的群可以撤回
     *
     * @param groupId 群号
     * @return 是否允许
     */
    public boolean isGroupAllowed(String groupId) {
        return groupWhitelist.isEmpty() || groupWhitelist.contains(groupId);
    }

    /**
     * 校验配置
     * maxRecallTime 只限制手动设置的撤回时间，不约束各项默认时间
     *
     * @throws IllegalArgumentException 配置不合法时
     */
    public void validate() {
        if (maxRecallTime < 1) {
            throw new IllegalArgumentException("maxRecallTime 必须大于 0");
        }
        if (delayMode == null) {
            throw new IllegalArgumentException("delayMode 不能为空");
        }
        checkPositive("privateRecallTime", privateRecallTime);
        checkPositive("groupRecallTime", groupRecallTime);
        checkPositive("adminRecallTime", adminRecallTime);
        checkPositive("memberRecallTime", memberRecallTime);
        for (String groupId : groupWhitelist) {
            if (groupId == null || groupId.trim().isEmpty()) {
                throw new IllegalArgumentException("groupWhitelist 中存在空群号");
            }
        }
    }

    private static void checkPositive(String name, long value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " 必须大于 0，当前值: " + value);
        }
    }
}
