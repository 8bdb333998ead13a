package com.work.batchbuy.core.support;

import org.web3j.crypto.WalletUtils;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 构造期参数校验：配置、金额、地址。失败统一抛 IllegalArgumentException。
 */
public final class ValidationUtils {

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 非 null 且去空白后非空。
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 非 null。
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为 null");
        }
        return value;
    }

    /**
     * 严格为正的时长，例如轮询间隔。
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    /**
     * 允许为 0（表示不等待）。
     */
    public static Duration requireNonNegative(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative()) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return duration;
    }

    public static long requireNonNegative(long value, String paramName) {
        if (value < 0) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return value;
    }

    public static BigInteger requireNonNegative(BigInteger value, String paramName) {
        requireNonNull(value, paramName);
        if (value.signum() < 0) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return value;
    }

    public static int requirePositive(int value, String paramName) {
        if (value <= 0) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return value;
    }

    /**
     * 校验 EVM 地址格式（0x + 40 位十六进制），不校验 checksum 大小写。
     */
    public static String requireAddress(String address, String paramName) {
        requireNonEmpty(address, paramName);
        if (!WalletUtils.isValidAddress(address.trim())) {
            throw new IllegalArgumentException(paramName + " 不是合法地址: " + address);
        }
        return address.trim();
    }
}
