package cn.bafuka.selfrecall.spel;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.util.StringUtils;

import java.lang.reflect.Method;

/**
 * SpEL 表达式解析器默认实现
 * 基于 Spring Expression Language
 */
@Slf4j
public class DefaultSpelExpressionParser implements SpelExpressionParser {

    /**
     * SpEL 表达式解析器
     */
    private final ExpressionParser parser = new org.springframework.expression.spel.standard.SpelExpressionParser();

    /**
     * 参数名发现器
     */
    private final ParameterNameDiscoverer parameterNameDiscoverer = new DefaultParameterNameDiscoverer();

    @Override
    public Object parseValue(String expression, ProceedingJoinPoint joinPoint) {
        if (!StringUtils.hasText(expression)) {
            return null;
        }

        try {
            EvaluationContext context = createEvaluationContext(joinPoint);
            Expression exp = parser.parseExpression(expression);
            return exp.getValue(context);
        } catch (Exception e) {
            log.error("失败: parse SpEL expression: {}", expression, e);
            return null;
        }
    }

    @Override
    public boolean parseCondition(String expression, ProceedingJoinPoint joinPoint) {
        // 空表达式视为条件成立
        if (!StringUtils.hasText(expression)) {
            return true;
        }

        try {
            EvaluationContext context = createEvaluationContext(joinPoint);
            Expression exp = parser.parseExpression(expression);
            Boolean result = exp.getValue(context, Boolean.class);
            return result != null && result;
        } catch (Exception e) {
            log.error("失败: parse SpEL condition expression: {}", expression, e);
            return false;
        }
    }

    /**
     * 创建 SpEL 求值上下文
     *
     * 使用只读的 SimpleEvaluationContext，表达式只能访问属性和调用实例方法，不能引用类型或创建对象
     *
     * @param joinPoint 切点
     * @return 求值上下文
     */
    private EvaluationContext createEvaluationContext(ProceedingJoinPoint joinPoint) {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        Object[] args = joinPoint.getArgs();

        SimpleEvaluationContext context = SimpleEvaluationContext
                .forReadOnlyDataBinding()
                .withInstanceMethods()
                .build();

        // 设置参数名称
        String[] parameterNames = parameterNameDiscoverer.getParameterNames(method);
        if (parameterNames != null) {
            for (int i = 0; i < parameterNames.length && i < args.length; i++) {
                context.setVariable(parameterNames[i], args[i]);
            }
        }

        // 设置 p0, p1, p2... 参数别名
        for (int i = 0; i < args.length; i++) {
            context.setVariable("p" + i, args[i]);
            context.setVariable("a" + i, args[i]);
        }

        return context;
    }
}
