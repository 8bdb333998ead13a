package com.work.batchbuy.core.support;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

import static com.work.batchbuy.core.support.ValidationUtils.requireNonNull;

/**
 * 代币金额换算：人类可读金额 <-> 最小单位整数。
 * 使用 BigDecimal 精确换算，0.1 不会因浮点误差变成 99999。
 */
public final class TokenAmounts {

    private TokenAmounts() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 超出精度的小数位向下截断。
     */
    public static BigInteger toSmallestUnit(BigDecimal human, int decimals) {
        requireNonNull(human, "human");
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals 不能为负数");
        }
        if (human.signum() < 0) {
            throw new IllegalArgumentException("金额不能为负数: " + human);
        }
        return human.movePointRight(decimals).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
    }

    public static BigDecimal toHuman(BigInteger smallest, int decimals) {
        requireNonNull(smallest, "smallest");
        if (decimals <= 0) {
            return new BigDecimal(smallest);
        }
        return new BigDecimal(smallest).movePointLeft(decimals).stripTrailingZeros();
    }
}
