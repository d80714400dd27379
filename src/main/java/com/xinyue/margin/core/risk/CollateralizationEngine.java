package com.xinyue.margin.core.risk;

import com.xinyue.margin.common.ScaleConstants;
import com.xinyue.margin.core.account.AccountBalance;

import java.math.BigDecimal;

/**
 * 抵押率校验。
 * <p>
 * 账户价值拆成正负两部分：
 * - positiveValue：保证金与仓位市值中为正的部分之和
 * - negativeValue：保证金与仓位市值中为负的部分之和（取绝对值）
 * 满足 positiveValue >= negativeValue * minCollateral 即视为抵押充足，恰好相等也算通过。
 * minCollateral = 1 时等价于 equity = margin + position * price >= 0。
 * <p>
 * 全部使用 BigDecimal 精确计算，position * price 不做任何截断。
 */
public final class CollateralizationEngine {

    private final BigDecimal minCollateral;

    public CollateralizationEngine(BigDecimal minCollateral) {
        if (minCollateral == null || minCollateral.compareTo(BigDecimal.ONE) < 0) {
            throw new IllegalArgumentException("minCollateral 必须大于等于 1: " + minCollateral);
        }
        this.minCollateral = minCollateral;
    }

    public static CollateralizationEngine withoutBuffer() {
        return new CollateralizationEngine(BigDecimal.ONE);
    }

    public BigDecimal minCollateral() {
        return minCollateral;
    }

    /**
     * 判断 (保证金, 仓位, 价格) 是否抵押充足。无仓位的账户总是通过。
     *
     * @param marginE8   保证金（放大 1e8）
     * @param positionE8 仓位（放大 1e8，带符号）
     * @param priceE8    价格（放大 1e8，非负）
     */
    public boolean isCollateralized(long marginE8, long positionE8, long priceE8) {
        if (priceE8 < 0) {
            throw new IllegalArgumentException("价格不能为负: " + priceE8);
        }
        if (positionE8 == 0) {
            return true;
        }
        BigDecimal margin = ScaleConstants.fromE8(marginE8);
        BigDecimal positionValue = positionValue(positionE8, priceE8);

        BigDecimal positiveValue = positivePart(margin).add(positivePart(positionValue));
        BigDecimal negativeValue = positivePart(margin.negate()).add(positivePart(positionValue.negate()));
        return positiveValue.compareTo(negativeValue.multiply(minCollateral)) >= 0;
    }

    public boolean isCollateralized(AccountBalance balance, long priceE8) {
        return isCollateralized(balance.marginE8(), balance.positionE8(), priceE8);
    }

    /**
     * equity = margin + position * price
     */
    public BigDecimal equity(long marginE8, long positionE8, long priceE8) {
        return ScaleConstants.fromE8(marginE8).add(positionValue(positionE8, priceE8));
    }

    private static BigDecimal positionValue(long positionE8, long priceE8) {
        // scale 8 * scale 8 = scale 16，精确
        return ScaleConstants.fromE8(positionE8).multiply(ScaleConstants.fromE8(priceE8));
    }

    private static BigDecimal positivePart(BigDecimal value) {
        return value.signum() > 0 ? value : BigDecimal.ZERO;
    }
}
