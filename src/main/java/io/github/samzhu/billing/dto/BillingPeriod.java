package io.github.samzhu.billing.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 計費排程中的單一期間 (輸出單位，產生後不可變)。
 *
 * <p>欄位分類：
 * <ul>
 *   <li>期間 - {@code periodStart} ~ {@code periodEnd}，皆含</li>
 *   <li>數量 - {@code coveredMonths} 為片段比例加總 (上限截斷前)，
 *       {@code quantityMonths} 為實際計費月數 (截斷後)</li>
 *   <li>金額 - {@code unitsBilled} = quantityMonths × quantityPerMonth，
 *       {@code amount} = unitsBilled × pricePerMonth</li>
 *   <li>{@code prorated} - 期間不足一個完整週期或遭上限截斷</li>
 *   <li>{@code breakdown} - 依月份排序的片段明細</li>
 * </ul>
 */
public record BillingPeriod(
    LocalDate periodStart,
    LocalDate periodEnd,
    BigDecimal coveredMonths,
    BigDecimal quantityMonths,
    BigDecimal unitsBilled,
    BigDecimal amount,
    boolean prorated,
    List<MonthFragment> breakdown
) {
    public BillingPeriod {
        breakdown = List.copyOf(breakdown);
    }

    public PeriodBounds bounds() {
        return new PeriodBounds(periodStart, periodEnd);
    }
}
