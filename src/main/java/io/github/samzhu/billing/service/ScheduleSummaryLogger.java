package io.github.samzhu.billing.service;

import java.math.BigDecimal;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.config.BillingProperties.ReportConfig;
import io.github.samzhu.billing.config.BillingProperties.RoundingConfig;
import io.github.samzhu.billing.dto.BillingParameters;
import io.github.samzhu.billing.dto.BillingPeriod;
import io.github.samzhu.billing.dto.MonthFragment;

/**
 * 排程摘要日誌輸出。
 *
 * <p>只讀取已產生的排程，不參與計算。輸出格式：
 * <pre>
 * Billing period: 2025-02-15 -> 2025-03-01
 *   quantity (months) = 0.5323
 *   units billed      = 2.6613
 *   amount            = ₹26.61
 *   Feb 2025: 14/28 days -> 0.5000 x 5 units x ₹10 = ₹25.00
 *   Mar 2025: 1/31 days -> 0.0323 x 5 units x ₹10 = ₹1.61
 * </pre>
 */
@Component
public class ScheduleSummaryLogger {

    private static final Logger log = LoggerFactory.getLogger(ScheduleSummaryLogger.class);

    private final RoundingConfig rounding;
    private final ReportConfig report;

    public ScheduleSummaryLogger(BillingProperties properties) {
        this.rounding = properties.rounding();
        this.report = properties.report();
    }

    /**
     * 逐期輸出排程摘要，最後輸出合計。
     *
     * @param params 產生排程時使用的參數
     * @param schedule 計費期間
     */
    public void logSchedule(BillingParameters params, List<BillingPeriod> schedule) {
        if (!log.isInfoEnabled()) {
            return;
        }
        schedule.forEach(period -> logPeriod(params, period));

        BigDecimal totalUnits = schedule.stream()
            .map(BillingPeriod::unitsBilled)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalAmount = schedule.stream()
            .map(BillingPeriod::amount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        log.info("Billing schedule summary: periods={}, totalUnits={}, totalAmount={}{}",
            schedule.size(), quantity(totalUnits), report.currencySymbol(), amount(totalAmount));
    }

    private void logPeriod(BillingParameters params, BillingPeriod period) {
        String currency = report.currencySymbol();
        log.info("Billing period: {} -> {}{}", period.periodStart(), period.periodEnd(),
            period.prorated() ? " (prorated)" : "");
        log.info("  quantity (months) = {}", quantity(period.quantityMonths()));
        log.info("  units billed      = {}", quantity(period.unitsBilled()));
        log.info("  amount            = {}{}", currency, amount(period.amount()));
        for (MonthFragment fragment : period.breakdown()) {
            log.info("  {}: {}/{} days -> {} x {} units x {}{} = {}{}",
                fragment.label(),
                fragment.activeDays(),
                fragment.totalDays(),
                quantity(fragment.fraction()),
                params.quantityPerMonth().toPlainString(),
                currency,
                params.pricePerMonth().toPlainString(),
                currency,
                amount(fragment.partialAmount()));
        }
    }

    private String quantity(BigDecimal value) {
        return value.setScale(rounding.quantityScale(), rounding.mode()).toPlainString();
    }

    private String amount(BigDecimal value) {
        return value.setScale(rounding.amountScale(), rounding.mode()).toPlainString();
    }
}
