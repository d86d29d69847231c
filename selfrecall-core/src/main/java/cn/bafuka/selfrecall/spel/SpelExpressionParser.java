package cn.bafuka.selfrecall.spel;

import org.aspectj.lang.ProceedingJoinPoint;

/**
 * SpEL 表达式解析器接口
 * 用于解析 {@link cn.bafuka.selfrecall.annotation.AutoRecall} 中的表达式
 */
public interface SpelExpressionParser {

    /**
     * 解析表达式
     *
     * @param expression SpEL 表达式
     * @param joinPoint  切点
     * @return 解析后的值，失败返回 null
     */
    Object parseValue(String expression, ProceedingJoinPoint joinPoint);

    /**
     * 解析条件表达式
     *
     * @param expression SpEL 表达式
     * @param joinPoint  切点
     * @return true 表示条件满足，空表达式视为满足
     */
    boolean parseCondition(String expression, ProceedingJoinPoint joinPoint);
}
