package com.xinyue.margin.core.risk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.xinyue.margin.common.ScaleConstants.toE8;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("抵押率校验")
class CollateralizationEngineTest {

    private final CollateralizationEngine engine = CollateralizationEngine.withoutBuffer();

    @Test
    @DisplayName("无仓位总是通过，即使价格为 0")
    void zeroPositionAlwaysPasses() {
        assertTrue(engine.isCollateralized(toE8("-5"), 0, 0));
        assertTrue(engine.isCollateralized(0, 0, toE8("100")));
    }

    @Test
    @DisplayName("权益恰好为 0 时通过，略低于 0 时拒绝")
    void boundaryIsInclusive() {
        // 空头 10 @ 100，保证金 1000 -> equity = 0
        assertTrue(engine.isCollateralized(toE8("1000"), toE8("-10"), toE8("100")));
        assertFalse(engine.isCollateralized(toE8("999.99999999"), toE8("-10"), toE8("100")));
    }

    @Test
    @DisplayName("多头保证金为负时依靠仓位市值")
    void longPositionWithNegativeMargin() {
        assertTrue(engine.isCollateralized(toE8("-500"), toE8("5"), toE8("100")));
        assertFalse(engine.isCollateralized(toE8("-500.00000001"), toE8("5"), toE8("100")));
    }

    @Test
    @DisplayName("仓位市值计算不截断小数")
    void exactMultiplication() {
        // 0.00000001 * 0.00000001 = 1e-16，不能被舍入为 0
        assertFalse(engine.isCollateralized(0, toE8("-0.00000001"), toE8("0.00000001")));
        assertEquals(new BigDecimal("-1E-16"), engine.equity(0, toE8("-0.00000001"), toE8("0.00000001")).stripTrailingZeros());
    }

    @Test
    @DisplayName("抵押率 1.1：1100 保证金、空头 10 @ 100 恰好通过，再少 1 即失败")
    void bufferedRatio() {
        CollateralizationEngine buffered = new CollateralizationEngine(new BigDecimal("1.1"));

        assertTrue(buffered.isCollateralized(toE8("1100"), toE8("-10"), toE8("100")));
        assertFalse(buffered.isCollateralized(toE8("1099"), toE8("-10"), toE8("100")));
    }

    @Test
    @DisplayName("非法参数")
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new CollateralizationEngine(new BigDecimal("0.9")));
        assertThrows(IllegalArgumentException.class, () -> engine.isCollateralized(0, 1, -1));
    }
}
