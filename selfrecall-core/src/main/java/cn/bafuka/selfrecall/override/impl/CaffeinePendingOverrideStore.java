package cn.bafuka.selfrecall.override.impl;

import cn.bafuka.selfrecall.core.SessionId;
import cn.bafuka.selfrecall.override.PendingOverrideStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 基于 Caffeine 的一次性撤回覆盖存储
 * 读取即删除依赖 ConcurrentMap#remove 的原子性；设置了 TTL 时，长期没有消息的会话中的覆盖会自动过期
 */
@Slf4j
public class CaffeinePendingOverrideStore implements PendingOverrideStore {

    /**
     * 覆盖缓存
     * Key: 会话标识
     * Value: 撤回延迟
     */
    private final Cache<SessionId, Duration> overrides;

    /**
     * @param ttl 覆盖的存活时间，null 或非正数表示不过期
     */
    public CaffeinePendingOverrideStore(Duration ttl) {
        this(ttl, Ticker.systemTicker());
    }

    CaffeinePendingOverrideStore(Duration ttl, Ticker ticker) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder().ticker(ticker);
        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
            builder.expireAfterWrite(ttl.toNanos(), TimeUnit.NANOSECONDS);
        }
        this.overrides = builder.build();
        log.info("构建撤回覆盖缓存: ttl={}", ttl);
    }

    @Override
    public void setOverride(SessionId session, Duration delay) {
        Duration previous = overrides.asMap().put(session, delay);
        if (previous != null) {
            log.debug("撤回覆盖被替换: session={}, previous={}, delay={}", session, previous, delay);
        } else {
            log.debug("设置撤回覆盖: session={}, delay={}", session, delay);
        }
    }

    @Override
    public Optional<Duration> takeOverride(SessionId session) {
        Duration delay = overrides.asMap().remove(session);
        if (delay != null) {
            log.debug("消费撤回覆盖: session={}, delay={}", session, delay);
        }
        return Optional.ofNullable(delay);
    }

    @Override
    public Optional<Duration> peekOverride(SessionId session) {
        return Optional.ofNullable(overrides.getIfPresent(session));
    }

    @Override
    public void clear() {
        overrides.invalidateAll();
        overrides.cleanUp();
        log.info("撤回覆盖已清空");
    }

    @Override
    public long size() {
        overrides.cleanUp();
        return overrides.estimatedSize();
    }
}
