package io.github.samzhu.billing.service;

import java.math.BigDecimal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 計費總量上限檢查服務。
 *
 * <p>計算公式：
 * <pre>
 * units  = quantityMonths × quantityPerMonth
 * 若 totalBilledSoFar + units &gt; maxQuantity：
 *     units          = max(0, maxQuantity - totalBilledSoFar)
 *     quantityMonths = units / quantityPerMonth
 * amount = units × pricePerMonth
 * </pre>
 */
@Service
public class CapEnforcer {

    private static final Logger log = LoggerFactory.getLogger(CapEnforcer.class);

    /**
     * 套用上限並計算本期的計費單位與金額。
     *
     * @param quantityMonths 本期月份比例加總 (上限截斷前)
     * @param quantityPerMonth 完整一個月的用量單位數，必須大於 0
     * @param pricePerMonth 每單位每月單價
     * @param totalBilledSoFar 先前各期已計費的單位數
     * @param maxQuantity 累計計費單位數上限
     * @return 截斷後的數量、單位數、金額，以及是否觸及上限
     */
    public CapResult apply(BigDecimal quantityMonths, BigDecimal quantityPerMonth, BigDecimal pricePerMonth,
                           BigDecimal totalBilledSoFar, BigDecimal maxQuantity) {
        BigDecimal units = quantityMonths.multiply(quantityPerMonth);
        BigDecimal finalQuantityMonths = quantityMonths;
        boolean capReached = false;

        if (totalBilledSoFar.add(units).compareTo(maxQuantity) > 0) {
            units = maxQuantity.subtract(totalBilledSoFar).max(BigDecimal.ZERO);
            finalQuantityMonths = units.divide(quantityPerMonth, MonthFractionator.PRECISION);
            capReached = true;
            log.debug("Cap reached: billedSoFar={}, max={}, truncatedUnits={}",
                totalBilledSoFar, maxQuantity, units);
        }

        BigDecimal amount = units.multiply(pricePerMonth);
        return new CapResult(finalQuantityMonths, units, amount, capReached);
    }

    /**
     * 上限檢查結果。
     *
     * @param quantityMonths 最終計費月數
     * @param units 最終計費單位數
     * @param amount 最終金額
     * @param capReached 本期是否因上限被截斷
     */
    public record CapResult(
        BigDecimal quantityMonths,
        BigDecimal units,
        BigDecimal amount,
        boolean capReached
    ) {}
}
