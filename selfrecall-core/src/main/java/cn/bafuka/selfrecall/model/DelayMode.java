package cn.bafuka.selfrecall.model;

/**
 * 群聊默认撤回时间的计算方式
 */
public enum DelayMode {

    /**
     * 所有群统一使用 groupRecallTime
     */
    FLAT,

    /**
     * 按机器人在群内的身份区分 adminRecallTime / memberRecallTime
     */
    ROLE_AWARE
}
