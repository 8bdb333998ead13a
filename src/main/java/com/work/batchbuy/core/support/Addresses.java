package com.work.batchbuy.core.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Keys;
import org.web3j.crypto.WalletUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 地址规范化：转 checksum、过滤非法地址、保序去重。
 */
public final class Addresses {

    private static final Logger log = LoggerFactory.getLogger(Addresses.class);

    private Addresses() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static String toChecksum(String address) {
        String a = ValidationUtils.requireAddress(address, "address");
        return Keys.toChecksumAddress(a);
    }

    public static List<String> toChecksumList(Collection<String> addresses) {
        Set<String> unique = new LinkedHashSet<>();
        if (addresses == null) {
            return new ArrayList<>();
        }
        for (String a : addresses) {
            if (a == null || a.trim().isEmpty()) {
                continue;
            }
            if (!WalletUtils.isValidAddress(a.trim())) {
                log.warn("Invalid address skipped. address={}", a);
                continue;
            }
            unique.add(Keys.toChecksumAddress(a.trim()));
        }
        return new ArrayList<>(unique);
    }

    /**
     * 日志里使用的短地址标签，例如 0x1234ab。
     */
    public static String shortTag(String address) {
        if (address == null) {
            return "?";
        }
        return address.length() <= 8 ? address : address.substring(0, 8);
    }
}
