package io.github.samzhu.billing.service;

import java.time.LocalDate;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.billing.dto.BillingParameters;
import io.github.samzhu.billing.dto.PeriodBounds;
import io.github.samzhu.billing.util.PeriodUtils;

/**
 * 計費週期邊界計算服務。
 *
 * <p>排程由兩部分組成：
 * <ul>
 *   <li>首期 - 從計費起始日到第一個錨定日的前一天 (通常不足一個週期)</li>
 *   <li>後續週期 - 從第一個錨定日起，每次前進 {@code cycle.months()} 個月，
 *       最後一期截止於計費結束日</li>
 * </ul>
 *
 * <p>錨定日限制在 1-28，因此 {@link LocalDate#plusMonths(long)} 永遠保留相同的日期。
 */
@Service
public class PeriodBuilder {

    private static final Logger log = LoggerFactory.getLogger(PeriodBuilder.class);

    /**
     * 計算第一個錨定日。
     *
     * <p>取起始日所在月份的錨定日；若不晚於起始日，則順延一個月。
     * 因此第一個錨定日一定晚於起始日。
     *
     * @param params 計費參數
     * @return 第一個完整週期的起始日
     */
    public LocalDate firstAnchor(BillingParameters params) {
        LocalDate anchor = params.start().withDayOfMonth(params.cycleAnchorDay());
        if (!anchor.isAfter(params.start())) {
            anchor = anchor.plusMonths(1);
        }
        return anchor;
    }

    /**
     * 計算首期邊界：{@code [start, min(firstAnchor - 1 天, end)]}。
     *
     * @param params 計費參數
     * @return 首期起訖日，至少涵蓋一天
     */
    public PeriodBounds firstPeriod(BillingParameters params) {
        LocalDate end = PeriodUtils.min(firstAnchor(params).minusDays(1), params.end());
        PeriodBounds bounds = new PeriodBounds(params.start(), end);
        log.debug("First period: {} -> {}", bounds.start(), bounds.end());
        return bounds;
    }

    /**
     * 產生首期之後的週期邊界 (延遲計算)。
     *
     * <p>週期起始日超過計費結束日時停止；呼叫端可隨時停止取用 (例如已達上限)。
     *
     * @param params 計費參數
     * @return 依序排列的週期邊界
     */
    public Stream<PeriodBounds> subsequentPeriods(BillingParameters params) {
        int months = params.cycle().months();
        return Stream.iterate(
                firstAnchor(params),
                cycleStart -> !cycleStart.isAfter(params.end()),
                cycleStart -> cycleStart.plusMonths(months))
            .map(cycleStart -> new PeriodBounds(
                cycleStart,
                PeriodUtils.min(cycleStart.plusMonths(months).minusDays(1), params.end())));
    }
}
