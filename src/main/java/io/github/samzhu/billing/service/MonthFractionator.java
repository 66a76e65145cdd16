package io.github.samzhu.billing.service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.billing.dto.FractionResult;
import io.github.samzhu.billing.dto.MonthFragment;
import io.github.samzhu.billing.exception.InvalidRangeException;
import io.github.samzhu.billing.util.PeriodUtils;

/**
 * 月份比例計算服務。
 *
 * <p>將任意日期區間依日曆月切分，計算每個月被涵蓋的比例：
 * <pre>
 * 區間起點 = max(spanStart, 當月 1 號)
 * 區間終點 = min(spanEnd, 當月最後一天)
 * 計費天數 = 區間終點日 - 區間起點日 + 1
 * 月份比例 = 計費天數 / 當月總天數
 * </pre>
 *
 * <p>加總以 1/{@link PeriodUtils#MONTH_LENGTH_LCM} 月為單位的整數累加，因此完整月份的加總沒有誤差；
 * 單一片段的比例以 {@link MathContext#DECIMAL128} 表示。此處不做任何四捨五入。
 */
@Service
public class MonthFractionator {

    private static final Logger log = LoggerFactory.getLogger(MonthFractionator.class);

    static final MathContext PRECISION = MathContext.DECIMAL128;

    /**
     * 切分日期區間並計算月份比例。
     *
     * @param spanStart 區間起始日（含）
     * @param spanEnd 區間結束日（含）
     * @param quantityPerMonth 完整一個月的用量單位數
     * @param pricePerMonth 每單位每月單價
     * @return 比例加總與各月片段
     * @throws InvalidRangeException 若起始日晚於結束日，或切出的片段比例不在 (0, 1]
     */
    public FractionResult fractionate(LocalDate spanStart, LocalDate spanEnd,
                                      BigDecimal quantityPerMonth, BigDecimal pricePerMonth) {
        if (spanStart.isAfter(spanEnd)) {
            throw new InvalidRangeException(spanStart, spanEnd);
        }

        long monthUnits = 0;
        List<MonthFragment> fragments = new ArrayList<>();

        YearMonth last = YearMonth.from(spanEnd);
        for (YearMonth month = YearMonth.from(spanStart); !month.isAfter(last); month = month.plusMonths(1)) {
            LocalDate periodStart = PeriodUtils.max(spanStart, PeriodUtils.firstDayOf(month));
            LocalDate periodEnd = PeriodUtils.min(spanEnd, PeriodUtils.lastDayOf(month));

            int activeDays = PeriodUtils.inclusiveDaysWithinMonth(periodStart, periodEnd);
            int totalDays = month.lengthOfMonth();
            if (activeDays <= 0 || activeDays > totalDays) {
                throw new InvalidRangeException(periodStart, periodEnd, String.format(
                    "Month fragment out of range: month=%s, activeDays=%d, totalDays=%d",
                    PeriodUtils.formatPeriod(month), activeDays, totalDays));
            }

            BigDecimal fraction = BigDecimal.valueOf(activeDays)
                .divide(BigDecimal.valueOf(totalDays), PRECISION);
            BigDecimal partialUnits = fraction.multiply(quantityPerMonth);
            BigDecimal partialAmount = partialUnits.multiply(pricePerMonth);

            monthUnits += PeriodUtils.toMonthUnits(activeDays, totalDays);
            fragments.add(new MonthFragment(month, activeDays, totalDays, fraction, partialUnits, partialAmount));

            log.debug("Month fragment: month={}, activeDays={}/{}, fraction={}",
                PeriodUtils.formatPeriod(month), activeDays, totalDays, fraction);
        }

        return FractionResult.of(monthUnits, fragments);
    }
}
