package io.github.samzhu.billing.dto.api;

import java.math.BigDecimal;
import java.time.LocalDate;

import io.github.samzhu.billing.dto.BillingCycle;
import io.github.samzhu.billing.dto.BillingParameters;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * 計費排程請求。
 *
 * <p>用於 POST /api/v1/schedules 端點。日期使用 ISO 格式 {@code YYYY-MM-DD}。
 */
public record ScheduleRequest(
    @NotNull(message = "start is required")
    LocalDate start,

    @NotNull(message = "cycleAnchorDay is required")
    @Min(value = 1, message = "cycleAnchorDay must be between 1 and 28")
    @Max(value = 28, message = "cycleAnchorDay must be between 1 and 28")
    Integer cycleAnchorDay,

    @NotNull(message = "end is required")
    LocalDate end,

    @NotNull(message = "cycleLength is required")
    BillingCycle cycleLength,

    @NotNull(message = "pricePerMonth is required")
    @Positive(message = "pricePerMonth must be positive")
    BigDecimal pricePerMonth,

    @NotNull(message = "quantityPerMonth is required")
    @Positive(message = "quantityPerMonth must be positive")
    BigDecimal quantityPerMonth,

    @NotNull(message = "maxQuantity is required")
    @Positive(message = "maxQuantity must be positive")
    BigDecimal maxQuantity
) {
    /**
     * 轉換為計費參數，並執行完整驗證。
     */
    public BillingParameters toParameters() {
        return new BillingParameters(
            start,
            cycleAnchorDay != null ? cycleAnchorDay : 0,
            end,
            cycleLength,
            pricePerMonth,
            quantityPerMonth,
            maxQuantity
        );
    }
}
