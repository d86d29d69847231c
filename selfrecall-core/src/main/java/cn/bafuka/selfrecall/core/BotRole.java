package cn.bafuka.selfrecall.core;

/**
 * 机器人在群内的身份
 */
public enum BotRole {

    OWNER,

    ADMIN,

    MEMBER;

    /**
     * 群主和管理员视为高权限身份
     */
    public boolean isElevated() {
        return this == OWNER || this == ADMIN;
    }
}
