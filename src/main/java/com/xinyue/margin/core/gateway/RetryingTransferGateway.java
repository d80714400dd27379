package com.xinyue.margin.core.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalLong;

/**
 * 对暂时性划转失败（{@link TransferResult#UNAVAILABLE}）做有限次重试的装饰器。
 * 确定性失败（{@link TransferResult#REJECTED}）立即返回，不重试。
 */
public final class RetryingTransferGateway implements TransferGateway {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingTransferGateway.class);

    private final TransferGateway delegate;
    private final int maxAttempts;
    private final long backoffMs;

    public RetryingTransferGateway(TransferGateway delegate, int maxAttempts, long backoffMs) {
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
    public TransferResult pull(String from, long amountE8) {
        TransferResult result = delegate.pull(from, amountE8);
        for (int attempt = 2; result.isTransient() && attempt <= maxAttempts; attempt++) {
            LOG.warn("托管拉取暂时失败，第 {} 次重试: from={}, amountE8={}", attempt, from, amountE8);
            if (!pause()) {
                break;
            }
            result = delegate.pull(from, amountE8);
        }
        return result;
    }

    @Override
    public TransferResult push(String to, long amountE8) {
        TransferResult result = delegate.push(to, amountE8);
        for (int attempt = 2; result.isTransient() && attempt <= maxAttempts; attempt++) {
            LOG.warn("托管推送暂时失败，第 {} 次重试: to={}, amountE8={}", attempt, to, amountE8);
            if (!pause()) {
                break;
            }
            result = delegate.push(to, amountE8);
        }
        return result;
    }

    @Override
    public OptionalLong custodyBalanceE8() {
        return delegate.custodyBalanceE8();
    }

    private boolean pause() {
        if (backoffMs == 0) {
            return true;
        }
        try {
            Thread.sleep(backoffMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
