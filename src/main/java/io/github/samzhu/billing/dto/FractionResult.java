package io.github.samzhu.billing.dto;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

import io.github.samzhu.billing.util.PeriodUtils;

/**
 * 日期區間切分為月份片段後的結果。
 *
 * @param monthUnits 比例加總的精確分子，分母為 {@link PeriodUtils#MONTH_LENGTH_LCM}
 * @param quantityMonths 各片段比例加總
 * @param fragments 依月份排序的片段
 */
public record FractionResult(
    long monthUnits,
    BigDecimal quantityMonths,
    List<MonthFragment> fragments
) {
    public FractionResult {
        fragments = List.copyOf(fragments);
    }

    /**
     * 由精確分子建立結果。
     */
    public static FractionResult of(long monthUnits, List<MonthFragment> fragments) {
        BigDecimal quantityMonths = BigDecimal.valueOf(monthUnits)
            .divide(BigDecimal.valueOf(PeriodUtils.MONTH_LENGTH_LCM), MathContext.DECIMAL128);
        return new FractionResult(monthUnits, quantityMonths, fragments);
    }

    /**
     * 比例加總是否剛好等於指定月數。
     */
    public boolean coversWholeMonths(int months) {
        return monthUnits == months * PeriodUtils.MONTH_LENGTH_LCM;
    }

    /**
     * 所有片段的計費天數加總。
     */
    public long totalActiveDays() {
        return fragments.stream()
            .mapToLong(MonthFragment::activeDays)
            .sum();
    }
}
