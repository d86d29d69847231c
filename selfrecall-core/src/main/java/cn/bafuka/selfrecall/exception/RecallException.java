package cn.bafuka.selfrecall.exception;

/**
 * 撤回相关异常
 * 命令层根据 {@link Reason} 向用户返回提示；调度和删除阶段的异常只记录日志，不会抛到宿主
 *
 * @author SelfRecall Team
 * @since 1.0
 */
public class RecallException extends RuntimeException {

    /**
     * 失败原因
     */
    private final Reason reason;

    public RecallException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RecallException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * 失败原因枚举
     */
    public enum Reason {
        /**
         * 当前会话未启用撤回
         */
        POLICY_DISABLED("未启用撤回"),

        /**
         * 撤回时间不在 [1, maxRecallTime] 之间
         */
        INVALID_DELAY("撤回时间不合法"),

        /**
         * 发送通道没有返回可撤回的消息句柄
         */
        HANDLE_UNRESOLVED("无法获取消息句柄"),

        /**
         * 平台拒绝或删除失败
         */
        DELETE_FAILED("撤回失败"),

        /**
         * 非管理员调用了受限命令
         */
        PERMISSION_DENIED("权限不足"),

        /**
         * 命令只能在群聊中使用
         */
        GROUP_ONLY("仅限群聊"),

        /**
         * 配置读取或写回失败
         */
        CONFIG_ERROR("配置错误");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    @Override
    public String toString() {
        return "RecallException{" +
                "reason=" + reason +
                ", message=" + getMessage() +
                '}';
    }
}
