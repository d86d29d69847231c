package cn.bafuka.selfrecall.aspect;

import cn.bafuka.selfrecall.annotation.AutoRecall;
import cn.bafuka.selfrecall.coordinator.OutgoingMessageEvent;
import cn.bafuka.selfrecall.coordinator.RecallCoordinator;
import cn.bafuka.selfrecall.core.DeletableHandle;
import cn.bafuka.selfrecall.core.SessionId;
import cn.bafuka.selfrecall.spel.SpelExpressionParser;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;

import java.util.Optional;

/**
 * SelfRecall AOP 切面
 * 拦截 @AutoRecall 注解，发送方法返回后交给撤回协调器；撤回环节的任何失败都不影响方法返回值
 */
@Slf4j
@Aspect
public class AutoRecallAspect {

    /**
     * SpEL 表达式解析器
     */
    private final SpelExpressionParser spelParser;

    /**
     * 撤回协调器
     */
    private final RecallCoordinator coordinator;

    public AutoRecallAspect(SpelExpressionParser spelParser, RecallCoordinator coordinator) {
        this.spelParser = spelParser;
        this.coordinator = coordinator;
    }

    /**
     * 拦截 @AutoRecall 注解
     */
    @Around("@annotation(autoRecall)")
    public Object aroundSend(ProceedingJoinPoint joinPoint, AutoRecall autoRecall) throws Throwable {
        Object result = joinPoint.proceed();

        if (!autoRecall.enabled()) {
            return result;
        }

        try {
            if (!spelParser.parseCondition(autoRecall.condition(), joinPoint)) {
                log.debug("Condition not met, skipping recall: method={}", joinPoint.getSignature().getName());
                return result;
            }

            SessionId session = toSession(spelParser.parseValue(autoRecall.session(), joinPoint));
            if (session == null) {
                log.warn("Failed to parse session, skipping recall: method={}, expression={}",
                        joinPoint.getSignature().getName(), autoRecall.session());
                return result;
            }

            coordinator.onOutgoingMessage(OutgoingMessageEvent.builder()
                    .session(session)
                    .handle(toHandle(result))
                    .build());
        } catch (Exception e) {
            log.error("自动撤回处理失败: method={}", joinPoint.getSignature().getName(), e);
        }

        return result;
    }

    private SessionId toSession(Object value) {
        if (value instanceof SessionId) {
            return (SessionId) value;
        }
        if (value instanceof String) {
            try {
                return SessionId.parse((String) value);
            } catch (IllegalArgumentException e) {
                log.warn("无法解析会话标识: {}", value);
            }
        }
        return null;
    }

    private DeletableHandle toHandle(Object result) {
        if (result instanceof DeletableHandle) {
            return (DeletableHandle) result;
        }
        if (result instanceof Optional) {
            Object value = ((Optional<?>) result).orElse(null);
            if (value instanceof DeletableHandle) {
                return (DeletableHandle) value;
            }
        }
        return null;
    }
}
