package com.work.batchbuy.core.orchestrator;

import java.util.List;

/**
 * 按账户位置轮询分配代理：第 i 个账户（从 1 开始）使用 proxies[(i-1) % n]。
 */
public final class ProxyRotation {

    private ProxyRotation() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * @param position 账户位置，从 1 开始
     * @return 代理地址；未配置代理时返回 null（直连）
     */
    public static String forPosition(List<String> proxies, int position) {
        if (position < 1) {
            throw new IllegalArgumentException("position 必须从1开始: " + position);
        }
        if (proxies == null || proxies.isEmpty()) {
            return null;
        }
        return proxies.get((position - 1) % proxies.size());
    }
}
