package io.github.samzhu.billing.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 排程產生過程中的累計狀態。
 *
 * <p>每一步都回傳新的狀態物件，累計值透過回傳值傳遞，不存放在任何共用欄位。
 *
 * <p>狀態轉換：
 * <pre>
 * GENERATING_FIRST_PERIOD ─(已達上限)─→ TERMINATED
 *          │
 *          └─→ GENERATING_CYCLES ─(已達上限 / 週期起始超過結束日)─→ TERMINATED
 * </pre>
 *
 * @param phase 目前階段
 * @param totalUnitsBilled 目前已計費的單位數
 * @param cycleCursor 下一個期間的起始日
 */
public record ScheduleState(
    Phase phase,
    BigDecimal totalUnitsBilled,
    LocalDate cycleCursor
) {
    public enum Phase {
        GENERATING_FIRST_PERIOD,
        GENERATING_CYCLES,
        TERMINATED
    }

    /**
     * 建立初始狀態，游標位於計費起始日。
     */
    public static ScheduleState initial(LocalDate billingStart) {
        return new ScheduleState(Phase.GENERATING_FIRST_PERIOD, BigDecimal.ZERO, billingStart);
    }

    /**
     * 記錄一期的計費單位，並決定下一個階段。
     *
     * @param units 本期計費單位數
     * @param nextCursor 下一期的起始日
     * @param maxQuantity 累計上限
     * @return 新狀態；累計達上限時進入 TERMINATED
     */
    public ScheduleState record(BigDecimal units, LocalDate nextCursor, BigDecimal maxQuantity) {
        if (phase == Phase.TERMINATED) {
            throw new IllegalStateException("Schedule generation already terminated");
        }
        BigDecimal total = totalUnitsBilled.add(units);
        Phase next = total.compareTo(maxQuantity) >= 0 ? Phase.TERMINATED : Phase.GENERATING_CYCLES;
        return new ScheduleState(next, total, nextCursor);
    }

    /**
     * 週期已用盡時結束產生。
     */
    public ScheduleState terminate() {
        return new ScheduleState(Phase.TERMINATED, totalUnitsBilled, cycleCursor);
    }

    public boolean isTerminated() {
        return phase == Phase.TERMINATED;
    }
}
