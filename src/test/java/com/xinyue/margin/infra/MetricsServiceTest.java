package com.xinyue.margin.infra;

import com.xinyue.margin.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("账本指标")
class MetricsServiceTest {

    @Test
    @DisplayName("计数与快照")
    void countsAndSnapshot() {
        MetricsService metrics = new MetricsService();
        metrics.recordDeposit(100);
        metrics.recordDeposit(50);
        metrics.recordWithdrawal(30);
        metrics.recordRejection(ErrorCode.UNAUTHORIZED);
        metrics.recordRejection(ErrorCode.UNAUTHORIZED);

        assertEquals(2, metrics.deposits());
        assertEquals(1, metrics.withdrawals());
        assertEquals(2, metrics.rejections(ErrorCode.UNAUTHORIZED));

        Map<String, Long> snapshot = metrics.snapshot();
        assertEquals(150L, snapshot.get("depositedE8"));
        assertEquals(30L, snapshot.get("withdrawnE8"));
        assertEquals(2L, snapshot.get("rejected.UNAUTHORIZED"));
        assertFalse(snapshot.containsKey("rejected.LEDGER_HALTED"));
    }
}
