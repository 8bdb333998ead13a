package com.work.batchbuy.core.token;

import com.work.batchbuy.core.metrics.BatchMetrics;
import com.work.batchbuy.core.support.Addresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Locale;

import static com.work.batchbuy.core.support.ValidationUtils.requireNonNull;

/**
 * 判断 owner 对 spender 的 allowance 是否已达到高水位阈值。
 *
 * 这是减少重复授权的优化，不是正确性门槛：查询失败一律视为“不足”，由调用方重新授权，从不抛异常。
 */
public class AllowanceOracle {

    private static final Logger log = LoggerFactory.getLogger(AllowanceOracle.class);

    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    /**
     * MAX_UINT256 / 2：足够大，多次 buy 之后仍很少需要重新授权。
     */
    public static final BigInteger DEFAULT_THRESHOLD = MAX_UINT256.shiftRight(1);

    private final TokenReader reader;
    private final BigInteger threshold;
    private final BatchMetrics metrics;

    public AllowanceOracle(TokenReader reader, BigInteger threshold, BatchMetrics metrics) {
        this.reader = requireNonNull(reader, "reader");
        this.threshold = requireNonNull(threshold, "threshold");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    public Sufficiency check(String owner, String spender) {
        BigInteger current;
        try {
            current = reader.allowance(owner, spender);
        } catch (RuntimeException e) {
            log.warn("[{}] allowance query failed, will approve. spender={} err={}",
                    Addresses.shortTag(owner), spender, e.getMessage());
            metrics.allowanceCheck("unknown");
            return Sufficiency.UNKNOWN;
        }
        Sufficiency s = current.compareTo(threshold) >= 0 ? Sufficiency.SUFFICIENT : Sufficiency.INSUFFICIENT;
        metrics.allowanceCheck(s.name().toLowerCase(Locale.ROOT));
        return s;
    }

    public boolean sufficient(String owner, String spender) {
        return check(owner, spender) == Sufficiency.SUFFICIENT;
    }
}
