package com.xinyue.margin.io.custody;

import com.xinyue.margin.core.gateway.TransferGateway;
import com.xinyue.margin.core.gateway.TransferResult;
import org.agrona.collections.Object2LongHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalLong;

/**
 * 进程内托管：记录每个外部持有人的抵押资产余额以及系统托管账户余额。
 * <p>
 * 用于本地运行和测试，替代真实的链上/银行托管。可通过 {@link #setAvailable(boolean)} 模拟托管服务中断。
 */
public final class InMemoryCustody implements TransferGateway {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryCustody.class);

    // 持有量不会为负，-1 作为缺失值
    private static final long MISSING = -1L;

    private final Object2LongHashMap<String> holdings = new Object2LongHashMap<>(MISSING);
    private long custodyE8;
    private volatile boolean available = true;

    /**
     * 给外部持有人铸造资产（仅用于初始化资金）。
     */
    public synchronized void mint(String holder, long amountE8) {
        if (amountE8 < 0) {
            throw new IllegalArgumentException("铸造数量不能为负: " + amountE8);
        }
        holdings.put(holder, Math.addExact(holding(holder), amountE8));
    }

    public synchronized long balanceOf(String holder) {
        return holding(holder);
    }

    public synchronized long custodyE8() {
        return custodyE8;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public synchronized TransferResult pull(String from, long amountE8) {
        if (!available) {
            return TransferResult.UNAVAILABLE;
        }
        long balance = holding(from);
        if (amountE8 < 0 || balance < amountE8) {
            LOG.warn("托管拉取被拒绝: from={}, amountE8={}, balanceE8={}", from, amountE8, balance);
            return TransferResult.REJECTED;
        }
        holdings.put(from, balance - amountE8);
        custodyE8 += amountE8;
        return TransferResult.SUCCESS;
    }

    @Override
    public synchronized TransferResult push(String to, long amountE8) {
        if (!available) {
            return TransferResult.UNAVAILABLE;
        }
        if (amountE8 < 0 || custodyE8 < amountE8) {
            LOG.warn("托管推送被拒绝: to={}, amountE8={}, custodyE8={}", to, amountE8, custodyE8);
            return TransferResult.REJECTED;
        }
        custodyE8 -= amountE8;
        holdings.put(to, Math.addExact(holding(to), amountE8));
        return TransferResult.SUCCESS;
    }

    @Override
    public synchronized OptionalLong custodyBalanceE8() {
        return OptionalLong.of(custodyE8);
    }

    private long holding(String holder) {
        long value = holdings.getValue(holder);
        return value == MISSING ? 0L : value;
    }
}
