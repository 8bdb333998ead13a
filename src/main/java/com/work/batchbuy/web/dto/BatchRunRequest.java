package com.work.batchbuy.web.dto;

import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.List;

public class BatchRunRequest {

    @NotEmpty(message = "markets 不能为空")
    private List<String> markets;

    /**
     * 人类可读金额，例如 0.1 USDC。
     */
    @NotNull(message = "investment 不能为空")
    @DecimalMin(value = "0", inclusive = false, message = "investment 必须大于0")
    private BigDecimal investment;

    /**
     * 0 = 涨，1 = 跌。
     */
    @NotNull(message = "outcomeIndex 不能为空")
    @Min(value = 0, message = "outcomeIndex 不能为负数")
    private Integer outcomeIndex;

    @DecimalMin(value = "0", message = "minOutcomeTokens 不能为负数")
    private BigDecimal minOutcomeTokens;

    /**
     * 可选，覆盖配置的线程池宽度。
     */
    @Min(value = 1, message = "maxWorkers 必须大于0")
    private Integer maxWorkers;

    public List<String> getMarkets() {
        return markets;
    }

    public void setMarkets(List<String> markets) {
        this.markets = markets;
    }

    public BigDecimal getInvestment() {
        return investment;
    }

    public void setInvestment(BigDecimal investment) {
        this.investment = investment;
    }

    public Integer getOutcomeIndex() {
        return outcomeIndex;
    }

    public void setOutcomeIndex(Integer outcomeIndex) {
        this.outcomeIndex = outcomeIndex;
    }

    public BigDecimal getMinOutcomeTokens() {
        return minOutcomeTokens;
    }

    public void setMinOutcomeTokens(BigDecimal minOutcomeTokens) {
        this.minOutcomeTokens = minOutcomeTokens;
    }

    public Integer getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(Integer maxWorkers) {
        this.maxWorkers = maxWorkers;
    }
}
