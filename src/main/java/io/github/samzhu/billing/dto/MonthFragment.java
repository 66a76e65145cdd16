package io.github.samzhu.billing.dto;

import java.math.BigDecimal;
import java.time.YearMonth;

import io.github.samzhu.billing.util.PeriodUtils;

/**
 * 計費期間落在單一日曆月內的片段。
 *
 * <p>所有數值保留完整精度，四捨五入只在輸出 API 回應時進行。
 * 片段永遠隸屬於某個 {@link BillingPeriod}，不單獨存在。
 *
 * @param month 所屬月份
 * @param activeDays 該月內實際計費天數
 * @param totalDays 該月總天數 (28/29/30/31)
 * @param fraction 月份使用比例 = activeDays / totalDays，範圍 (0, 1]
 * @param partialUnits 該片段的用量單位 = fraction × quantityPerMonth
 * @param partialAmount 該片段的金額 = partialUnits × pricePerMonth
 */
public record MonthFragment(
    YearMonth month,
    int activeDays,
    int totalDays,
    BigDecimal fraction,
    BigDecimal partialUnits,
    BigDecimal partialAmount
) {
    /**
     * 顯示用月份標籤，如 {@code Feb 2025}。
     */
    public String label() {
        return PeriodUtils.formatMonthLabel(month);
    }
}
