package cn.bafuka.selfrecall.core;

/**
 * 会话类型
 */
public enum ChatType {

    /**
     * 私聊
     */
    PRIVATE("PrivateMessage", "私聊"),

    /**
     * 群聊
     */
    GROUP("GroupMessage", "群聊");

    private final String originSegment;

    private final String displayName;

    ChatType(String originSegment, String displayName) {
        this.originSegment = originSegment;
        this.displayName = displayName;
    }

    /**
     * 会话来源标识中使用的片段，例如 {@code aiocqhttp:GroupMessage:100}
     */
    public String getOriginSegment() {
        return originSegment;
    }

    public String getDisplayName() {
        return displayName;
    }
}
