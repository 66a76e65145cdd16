package io.github.samzhu.billing.dto.api;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.github.samzhu.billing.config.BillingProperties.RoundingConfig;
import io.github.samzhu.billing.dto.MonthFragment;

/**
 * 計費期間的單月明細 (API 回應)。
 */
public record MonthBreakdownItem(
    String month,
    @JsonProperty("active_days") int activeDays,
    @JsonProperty("total_days") int totalDays,
    BigDecimal fraction,
    @JsonProperty("partial_units") BigDecimal partialUnits,
    @JsonProperty("partial_amount") BigDecimal partialAmount
) {
    /**
     * 從 MonthFragment 建立明細，並依設定四捨五入。
     */
    public static MonthBreakdownItem from(MonthFragment fragment, RoundingConfig rounding) {
        return new MonthBreakdownItem(
            fragment.label(),
            fragment.activeDays(),
            fragment.totalDays(),
            fragment.fraction().setScale(rounding.quantityScale(), rounding.mode()),
            fragment.partialUnits().setScale(rounding.quantityScale(), rounding.mode()),
            fragment.partialAmount().setScale(rounding.amountScale(), rounding.mode())
        );
    }
}
