package io.github.samzhu.billing.dto.api;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.github.samzhu.billing.config.BillingProperties.RoundingConfig;
import io.github.samzhu.billing.dto.BillingPeriod;

/**
 * 單一計費期間的 API 回應。
 *
 * <p>數量類欄位 (quantity_months、units_billed) 預設 4 位小數，金額 2 位小數。
 */
public record BillingPeriodResponse(
    @JsonProperty("billing_start") @JsonFormat(pattern = "yyyy-MM-dd") LocalDate billingStart,
    @JsonProperty("billing_end") @JsonFormat(pattern = "yyyy-MM-dd") LocalDate billingEnd,
    @JsonProperty("quantity_months") BigDecimal quantityMonths,
    @JsonProperty("units_billed") BigDecimal unitsBilled,
    BigDecimal amount,
    boolean prorated,
    List<MonthBreakdownItem> breakdown
) {
    /**
     * 從 BillingPeriod 建立回應物件。
     */
    public static BillingPeriodResponse from(BillingPeriod period, RoundingConfig rounding) {
        List<MonthBreakdownItem> items = period.breakdown().stream()
            .map(fragment -> MonthBreakdownItem.from(fragment, rounding))
            .toList();
        return new BillingPeriodResponse(
            period.periodStart(),
            period.periodEnd(),
            period.quantityMonths().setScale(rounding.quantityScale(), rounding.mode()),
            period.unitsBilled().setScale(rounding.quantityScale(), rounding.mode()),
            period.amount().setScale(rounding.amountScale(), rounding.mode()),
            period.prorated(),
            items
        );
    }

    /**
     * 從 BillingPeriod 列表建立回應列表，保留原順序。
     */
    public static List<BillingPeriodResponse> fromPeriods(List<BillingPeriod> periods, RoundingConfig rounding) {
        return periods.stream()
            .map(period -> from(period, rounding))
            .toList();
    }
}
