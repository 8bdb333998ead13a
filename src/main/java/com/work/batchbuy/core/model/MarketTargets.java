package com.work.batchbuy.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分组（priceOracleId） -> market 地址列表。构造后只读，可在所有 worker 间共享。
 * 保持调用方给出的顺序，worker 按该顺序遍历。
 */
public final class MarketTargets {

    /**
     * 直接传入 market 列表时使用的占位分组。
     */
    public static final int DEFAULT_GROUP = 0;

    private final Map<Integer, List<String>> byGroup;

    private MarketTargets(Map<Integer, List<String>> byGroup) {
        this.byGroup = byGroup;
    }

    public static MarketTargets of(Map<Integer, ? extends List<String>> groups) {
        Map<Integer, List<String>> copy = new LinkedHashMap<>();
        if (groups != null) {
            groups.forEach((group, markets) -> {
                if (group != null && markets != null && !markets.isEmpty()) {
                    copy.put(group, Collections.unmodifiableList(new ArrayList<>(markets)));
                }
            });
        }
        return new MarketTargets(Collections.unmodifiableMap(copy));
    }

    public static MarketTargets single(List<String> markets) {
        Map<Integer, List<String>> m = new LinkedHashMap<>();
        m.put(DEFAULT_GROUP, markets);
        return of(m);
    }

    public Map<Integer, List<String>> asMap() {
        return byGroup;
    }

    public boolean isEmpty() {
        return byGroup.isEmpty();
    }

    public int size() {
        int n = 0;
        for (List<String> markets : byGroup.values()) {
            n += markets.size();
        }
        return n;
    }

    @Override
    public String toString() {
        return "MarketTargets" + byGroup;
    }
}
