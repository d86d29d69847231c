package cn.bafuka.selfrecall.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 自动撤回注解
 * 标注在宿主的发送方法上，方法返回后按策略安排撤回。
 * 方法返回值必须是 {@link cn.bafuka.selfrecall.core.DeletableHandle} 或 {@code Optional<DeletableHandle>}
 *
 * 使用示例：
 * <pre>
 * {@code
 * @AutoRecall(session = "#session")
 * public Optional<DeletableHandle> reply(SessionId session, String text) {
 *     return platform.sendMessage(session, text);
 * }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface AutoRecall {

    /**
     * 会话表达式（支持 SpEL）
     * 结果可以是 SessionId，也可以是 {@code platform:GroupMessage:id} 形式的字符串
     *
     * @return SpEL 表达式
     */
    String session();

    /**
     * 条件表达式（可选）
     * 例如：#text.length() > 0
     *
     * @return SpEL 表达式，默认为空表示总是撤回
     */
    String condition() default "";

    /**
     * 是否启用
     *
     * @return 默认 true
     */
    boolean enabled() default true;
}
