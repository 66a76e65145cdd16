package io.github.samzhu.billing.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.dto.BillingParameters;
import io.github.samzhu.billing.dto.BillingPeriod;
import io.github.samzhu.billing.dto.FractionResult;
import io.github.samzhu.billing.dto.PeriodBounds;
import io.github.samzhu.billing.dto.ScheduleState;
import io.github.samzhu.billing.dto.api.ScheduleRequest;
import io.github.samzhu.billing.dto.api.ScheduleResponse;
import io.github.samzhu.billing.service.CapEnforcer.CapResult;

/**
 * 計費排程產生服務。
 *
 * <p>串接三個計算層並累計已計費單位數：
 * <ol>
 *   <li>{@link PeriodBuilder} - 決定首期與後續週期的邊界</li>
 *   <li>{@link MonthFractionator} - 計算每期的月份比例與明細</li>
 *   <li>{@link CapEnforcer} - 套用總量上限，必要時截斷該期</li>
 * </ol>
 *
 * <p>觸及上限的那一期一律輸出 (即使計費單位為 0)，之後不再產生任何期間。
 * 累計值保存在 {@link ScheduleState} 中，僅存在於單次呼叫，服務本身無狀態。
 */
@Service
public class BillingScheduleService {

    private static final Logger log = LoggerFactory.getLogger(BillingScheduleService.class);

    private final MonthFractionator fractionator;
    private final PeriodBuilder periodBuilder;
    private final CapEnforcer capEnforcer;
    private final ScheduleSummaryLogger summaryLogger;
    private final BillingProperties properties;

    public BillingScheduleService(MonthFractionator fractionator,
                                  PeriodBuilder periodBuilder,
                                  CapEnforcer capEnforcer,
                                  ScheduleSummaryLogger summaryLogger,
                                  BillingProperties properties) {
        this.fractionator = fractionator;
        this.periodBuilder = periodBuilder;
        this.capEnforcer = capEnforcer;
        this.summaryLogger = summaryLogger;
        this.properties = properties;
    }

    /**
     * 處理 API 請求：產生排程、輸出摘要日誌並轉換為回應物件。
     *
     * @param request 排程請求
     * @return 已四捨五入的排程回應
     */
    public ScheduleResponse generateSchedule(ScheduleRequest request) {
        BillingParameters params = request.toParameters();
        List<BillingPeriod> schedule = generate(params);

        if (properties.report().logPeriods()) {
            summaryLogger.logSchedule(params, schedule);
        }
        return ScheduleResponse.fromPeriods(schedule, properties.rounding());
    }

    /**
     * 產生完整計費排程。
     *
     * @param params 已驗證的計費參數
     * @return 依時間排序的計費期間，至少包含首期
     */
    public List<BillingPeriod> generate(BillingParameters params) {
        List<BillingPeriod> schedule = new ArrayList<>();
        ScheduleState state = ScheduleState.initial(params.start());

        try (Stream<PeriodBounds> cycles = periodBuilder.subsequentPeriods(params)) {
            Iterator<PeriodBounds> cycleIterator = cycles.iterator();

            while (!state.isTerminated()) {
                PeriodBounds bounds;
                if (state.phase() == ScheduleState.Phase.GENERATING_FIRST_PERIOD) {
                    bounds = periodBuilder.firstPeriod(params);
                } else if (cycleIterator.hasNext()) {
                    bounds = cycleIterator.next();
                } else {
                    state = state.terminate();
                    continue;
                }

                BillingPeriod period = billPeriod(params, bounds, state.totalUnitsBilled());
                schedule.add(period);
                state = state.record(period.unitsBilled(), bounds.end().plusDays(1), params.maxQuantity());
            }
        }

        log.info("Billing schedule generated: start={}, end={}, cycle={}, periods={}, totalUnits={}",
            params.start(), params.end(), params.cycle().code(), schedule.size(), state.totalUnitsBilled());
        return schedule;
    }

    /**
     * 計算單一期間的比例、上限截斷與金額。
     */
    private BillingPeriod billPeriod(BillingParameters params, PeriodBounds bounds, BigDecimal billedSoFar) {
        FractionResult fraction = fractionator.fractionate(
            bounds.start(), bounds.end(), params.quantityPerMonth(), params.pricePerMonth());

        CapResult capped = capEnforcer.apply(
            fraction.quantityMonths(),
            params.quantityPerMonth(),
            params.pricePerMonth(),
            billedSoFar,
            params.maxQuantity());

        boolean prorated = capped.capReached() || !fraction.coversWholeMonths(params.cycle().months());

        log.debug("Billing period: {} -> {}, quantityMonths={}, units={}, amount={}, prorated={}",
            bounds.start(), bounds.end(), capped.quantityMonths(), capped.units(), capped.amount(), prorated);

        return new BillingPeriod(
            bounds.start(),
            bounds.end(),
            fraction.quantityMonths(),
            capped.quantityMonths(),
            capped.units(),
            capped.amount(),
            prorated,
            fraction.fragments()
        );
    }
}
