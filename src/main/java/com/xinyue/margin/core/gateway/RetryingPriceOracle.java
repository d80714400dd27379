package com.xinyue.margin.core.gateway;

import com.xinyue.margin.exception.PriceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 预言机暂时不可用时做有限次重试的装饰器。最后一次失败原样抛出。
 */
public final class RetryingPriceOracle implements PriceOracle {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingPriceOracle.class);

    private final PriceOracle delegate;
    private final int maxAttempts;
    private final long backoffMs;

    public RetryingPriceOracle(PriceOracle delegate, int maxAttempts, long backoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts 必须大于 0");
        }
        if (backoffMs < 0) {
            throw new IllegalArgumentException("backoffMs 不能为负");
        }
        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.backoffMs = backoffMs;
    }

    @Override
    public long currentPriceE8() {
        for (int attempt = 1; ; attempt++) {
            try {
                return delegate.currentPriceE8();
            } catch (PriceUnavailableException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                LOG.warn("预言机暂时不可用，第 {} 次重试: {}", attempt + 1, e.getMessage());
                if (backoffMs > 0) {
                    try {
                        Thread.sleep(backoffMs);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw e;
                    }
                }
            }
        }
    }
}
