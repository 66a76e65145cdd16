package io.github.samzhu.billing.dto;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * 計費期間的起訖日。
 *
 * @param start 起始日期（含）
 * @param end 結束日期（含）
 */
public record PeriodBounds(
    LocalDate start,
    LocalDate end
) {
    /**
     * 期間涵蓋的天數 (含頭尾)。
     */
    public long dayCount() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }
}
