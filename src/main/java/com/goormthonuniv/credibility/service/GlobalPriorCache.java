package com.goormthonuniv.credibility.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.goormthonuniv.credibility.stats.GlobalPrior;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * global prior 를 TTL 동안 보관하는 get-or-compute 캐시.
 * 만료 후 첫 조회가 다시 계산한다. prior 는 천천히 변하므로 TTL 내의 오래된 값은 허용.
 */
public class GlobalPriorCache {

    private static final String KEY = "global";

    private final Cache<String, GlobalPrior> cache;

    public GlobalPriorCache(Duration ttl) {
        this(ttl, Ticker.systemTicker());
    }

    public GlobalPriorCache(Duration ttl, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(1)
                .ticker(ticker)
                .build();
    }

    public GlobalPrior getOrCompute(Supplier<GlobalPrior> loader) {
        return cache.get(KEY, k -> loader.get());
    }
}
