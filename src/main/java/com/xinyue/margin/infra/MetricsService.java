package com.xinyue.margin.infra;

import com.xinyue.margin.exception.ErrorCode;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * 记录账本级 KPI，后续接入 Micrometer/Prometheus 等指标后端。
 */
public final class MetricsService {

    private final LongAdder deposits = new LongAdder();
    private final LongAdder withdrawals = new LongAdder();
    private final LongAdder trades = new LongAdder();
    private final LongAdder operatorChanges = new LongAdder();
    private final LongAdder depositedE8 = new LongAdder();
    private final LongAdder withdrawnE8 = new LongAdder();
    private final EnumMap<ErrorCode, LongAdder> rejections = new EnumMap<>(ErrorCode.class);

    public MetricsService() {
        for (ErrorCode code : ErrorCode.values()) {
            rejections.put(code, new LongAdder());
        }
    }

    public void recordDeposit(long amountE8) {
        deposits.increment();
        depositedE8.add(amountE8);
    }

    public void recordWithdrawal(long amountE8) {
        withdrawals.increment();
        withdrawnE8.add(amountE8);
    }

    public void recordTrade() {
        trades.increment();
    }

    public void recordOperatorChange() {
        operatorChanges.increment();
    }

    public void recordRejection(ErrorCode code) {
        rejections.get(code).increment();
    }

    public long deposits() {
        return deposits.sum();
    }

    public long withdrawals() {
        return withdrawals.sum();
    }

    public long trades() {
        return trades.sum();
    }

    public long rejections(ErrorCode code) {
        return rejections.get(code).sum();
    }

    /**
     * 导出当前计数，供健康检查接口展示。
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> result = new LinkedHashMap<>();
        result.put("deposits", deposits.sum());
        result.put("withdrawals", withdrawals.sum());
        result.put("trades", trades.sum());
        result.put("operatorChanges", operatorChanges.sum());
        result.put("depositedE8", depositedE8.sum());
        result.put("withdrawnE8", withdrawnE8.sum());
        for (Map.Entry<ErrorCode, LongAdder> entry : rejections.entrySet()) {
            long count = entry.getValue().sum();
            if (count > 0) {
                result.put("rejected." + entry.getKey().name(), count);
            }
        }
        return result;
    }
}
