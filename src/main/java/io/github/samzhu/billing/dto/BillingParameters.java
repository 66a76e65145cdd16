package io.github.samzhu.billing.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import io.github.samzhu.billing.exception.InvalidParameterException;
import io.github.samzhu.billing.exception.InvalidRangeException;

/**
 * 產生計費排程所需的參數 (不可變)。
 *
 * <p>所有驗證在建構時一次完成，之後的計算不再檢查輸入：
 * <ul>
 *   <li>{@code start <= end}，否則拋出 {@link InvalidRangeException}</li>
 *   <li>{@code cycleAnchorDay} 介於 1-28，避免月底天數不一致的問題</li>
 *   <li>{@code pricePerMonth}、{@code quantityPerMonth}、{@code maxQuantity} 皆須大於 0</li>
 * </ul>
 *
 * @param start 計費起始日 (含)
 * @param cycleAnchorDay 每個週期開始的日期 (每月幾號)
 * @param end 計費結束日 (含)
 * @param cycle 計費週期
 * @param pricePerMonth 每單位每月單價
 * @param quantityPerMonth 完整一個月的用量單位數
 * @param maxQuantity 累計計費單位數上限
 */
public record BillingParameters(
    LocalDate start,
    int cycleAnchorDay,
    LocalDate end,
    BillingCycle cycle,
    BigDecimal pricePerMonth,
    BigDecimal quantityPerMonth,
    BigDecimal maxQuantity
) {
    public static final int MIN_ANCHOR_DAY = 1;
    public static final int MAX_ANCHOR_DAY = 28;

    public BillingParameters {
        requireNonNull(start, "start");
        requireNonNull(end, "end");
        requireNonNull(cycle, "cycleLength");
        if (start.isAfter(end)) {
            throw new InvalidRangeException(start, end);
        }
        if (cycleAnchorDay < MIN_ANCHOR_DAY || cycleAnchorDay > MAX_ANCHOR_DAY) {
            throw new InvalidParameterException("cycleAnchorDay",
                "must be between " + MIN_ANCHOR_DAY + " and " + MAX_ANCHOR_DAY + ", got " + cycleAnchorDay);
        }
        requirePositive(pricePerMonth, "pricePerMonth");
        requirePositive(quantityPerMonth, "quantityPerMonth");
        requirePositive(maxQuantity, "maxQuantity");
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new InvalidParameterException(name, "is required");
        }
    }

    private static void requirePositive(BigDecimal value, String name) {
        requireNonNull(value, name);
        if (value.signum() <= 0) {
            throw new InvalidParameterException(name, "must be positive, got " + value.toPlainString());
        }
    }
}
