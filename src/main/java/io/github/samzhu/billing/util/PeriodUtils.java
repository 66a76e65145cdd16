package io.github.samzhu.billing.util;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * 日曆月與計費期間的工具類。
 *
 * <p>所有日期皆為不含時區的日曆日期 ({@link LocalDate})。
 */
public final class PeriodUtils {

    /**
     * 28、29、30、31 的最小公倍數。任何「天數 / 當月天數」的比例都是 1/377580 的整數倍。
     */
    public static final long MONTH_LENGTH_LCM = 377_580L;

    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("MMM yyyy", Locale.ENGLISH);

    private PeriodUtils() {
        // 工具類不允許實例化
    }

    /**
     * 取得該月 1 號。
     */
    public static LocalDate firstDayOf(YearMonth month) {
        return month.atDay(1);
    }

    /**
     * 取得該月最後一天 (考慮閏年)。
     */
    public static LocalDate lastDayOf(YearMonth month) {
        return month.atEndOfMonth();
    }

    /**
     * 取得兩個日期中較晚者。
     */
    public static LocalDate max(LocalDate a, LocalDate b) {
        return a.isAfter(b) ? a : b;
    }

    /**
     * 取得兩個日期中較早者。
     */
    public static LocalDate min(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? a : b;
    }

    /**
     * 計算同一個月內兩日之間的天數 (含頭尾)。
     *
     * @param from 起始日
     * @param to 結束日，必須與起始日同月
     * @return 天數；起始日晚於結束日時為 0 或負數
     */
    public static int inclusiveDaysWithinMonth(LocalDate from, LocalDate to) {
        return to.getDayOfMonth() - from.getDayOfMonth() + 1;
    }

    /**
     * 將「計費天數 / 當月天數」換算為以 1/{@link #MONTH_LENGTH_LCM} 月為單位的整數。
     *
     * @param activeDays 計費天數
     * @param totalDays 當月天數
     * @return 比例的分子 (分母固定為 {@link #MONTH_LENGTH_LCM})
     */
    public static long toMonthUnits(int activeDays, int totalDays) {
        return activeDays * (MONTH_LENGTH_LCM / totalDays);
    }

    /**
     * 取得月份的顯示標籤。
     *
     * @param month 月份
     * @return 格式如 "Feb 2025"
     */
    public static String formatMonthLabel(YearMonth month) {
        return month.format(MONTH_LABEL);
    }

    /**
     * 取得月份的格式化字串。
     *
     * @param month 月份
     * @return 格式如 "2025-02"
     */
    public static String formatPeriod(YearMonth month) {
        return String.format("%d-%02d", month.getYear(), month.getMonthValue());
    }
}
