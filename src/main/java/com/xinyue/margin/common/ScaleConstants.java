package com.xinyue.margin.common;

import com.xinyue.margin.exception.ErrorCode;
import com.xinyue.margin.exception.LedgerException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 金额、仓位和价格的精度缩放常量。
 * <p>
 * 系统中所有保证金、仓位和价格都使用 long 类型存储，通过固定缩放因子（1e8）来保证精度。
 * 与外部的十进制表示互转时不做任何舍入：超出 8 位小数的输入直接拒绝。
 */
public final class ScaleConstants {

    /** 精度缩放因子（1e8，即 100,000,000） */
    public static final long SCALE_E8 = 100_000_000L;

    /** 缩放因子对应的小数位数 */
    public static final int SCALE_DIGITS = 8;

    private ScaleConstants() {
        // 工具类，禁止实例化
    }

    /**
     * 十进制数值转换为放大 1e8 的 long。
     *
     * @throws LedgerException INVALID_AMOUNT，当小数位超过 8 位或超出 long 范围
     */
    public static long toE8(BigDecimal value) {
        if (value == null) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "数值不能为空");
        }
        try {
            return value.setScale(SCALE_DIGITS, RoundingMode.UNNECESSARY).unscaledValue().longValueExact();
        } catch (ArithmeticException e) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT,
                    "数值超出 1e8 精度或 long 范围: " + value.toPlainString(), e);
        }
    }

    /**
     * 字符串形式的十进制数值转换为放大 1e8 的 long。
     */
    public static long toE8(String text) {
        if (text == null || text.isBlank()) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "数值不能为空");
        }
        try {
            return toE8(new BigDecimal(text.trim()));
        } catch (NumberFormatException e) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "无法解析数值: " + text, e);
        }
    }

    /**
     * 放大 1e8 的 long 还原为十进制数值（精确，scale = 8）。
     */
    public static BigDecimal fromE8(long valueE8) {
        return BigDecimal.valueOf(valueE8, SCALE_DIGITS);
    }
}
