package io.github.samzhu.billing.dto.api;

import java.math.BigDecimal;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.github.samzhu.billing.config.BillingProperties.RoundingConfig;
import io.github.samzhu.billing.dto.BillingPeriod;

/**
 * 計費排程 API 回應。
 *
 * <p>用於 POST /api/v1/schedules 端點，包含各期明細與整份排程的合計。
 * 合計由完整精度的數值加總後才四捨五入。
 */
public record ScheduleResponse(
    List<BillingPeriodResponse> periods,
    @JsonProperty("period_count") int periodCount,
    @JsonProperty("total_units_billed") BigDecimal totalUnitsBilled,
    @JsonProperty("total_amount") BigDecimal totalAmount
) {
    /**
     * 從 BillingPeriod 列表建立回應物件。
     */
    public static ScheduleResponse fromPeriods(List<BillingPeriod> periods, RoundingConfig rounding) {
        BigDecimal totalUnits = periods.stream()
            .map(BillingPeriod::unitsBilled)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalAmount = periods.stream()
            .map(BillingPeriod::amount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        return new ScheduleResponse(
            BillingPeriodResponse.fromPeriods(periods, rounding),
            periods.size(),
            totalUnits.setScale(rounding.quantityScale(), rounding.mode()),
            totalAmount.setScale(rounding.amountScale(), rounding.mode())
        );
    }
}
