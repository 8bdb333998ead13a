package com.work.batchbuy.discovery;

/**
 * 一个币种对应的 market 发现结果；address 为 null 表示获取失败。
 */
public final class DiscoveredMarket {

    private final String symbol;
    private final int oracleId;
    private final String address;

    public DiscoveredMarket(String symbol, int oracleId, String address) {
        this.symbol = symbol;
        this.oracleId = oracleId;
        this.address = address;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getOracleId() {
        return oracleId;
    }

    public String getAddress() {
        return address;
    }

    public boolean isFound() {
        return address != null;
    }
}
