package com.xinyue.margin.io.oracle;

import com.xinyue.margin.core.gateway.PriceOracle;
import com.xinyue.margin.exception.PriceUnavailableException;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 手动设置价格的预言机，用于本地运行和测试。未设置价格时视为不可用。
 */
public final class FixedPriceOracle implements PriceOracle {

    private static final long UNSET = -1;

    private final AtomicLong priceE8 = new AtomicLong(UNSET);

    public FixedPriceOracle() {
    }

    public FixedPriceOracle(long priceE8) {
        setPriceE8(priceE8);
    }

    public void setPriceE8(long priceE8) {
        if (priceE8 < 0) {
            throw new IllegalArgumentException("价格不能为负: " + priceE8);
        }
        this.priceE8.set(priceE8);
    }

    public void clear() {
        priceE8.set(UNSET);
    }

    @Override
    public long currentPriceE8() {
        long value = priceE8.get();
        if (value == UNSET) {
            throw new PriceUnavailableException("尚未设置价格");
        }
        return value;
    }
}
