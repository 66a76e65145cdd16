package io.github.samzhu.billing.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.time.YearMonth;

import org.junit.jupiter.api.Test;

class PeriodUtilsTest {

    @Test
    void shouldResolveMonthBoundaries() {
        // Given
        YearMonth leapFebruary = YearMonth.of(2024, 2);

        // When & Then
        assertThat(PeriodUtils.firstDayOf(leapFebruary)).isEqualTo(LocalDate.of(2024, 2, 1));
        assertThat(PeriodUtils.lastDayOf(leapFebruary)).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(PeriodUtils.lastDayOf(YearMonth.of(2025, 2))).isEqualTo(LocalDate.of(2025, 2, 28));
    }

    @Test
    void shouldPickEarlierAndLaterDates() {
        LocalDate a = LocalDate.of(2025, 3, 1);
        LocalDate b = LocalDate.of(2025, 3, 2);

        assertThat(PeriodUtils.min(a, b)).isEqualTo(a);
        assertThat(PeriodUtils.max(a, b)).isEqualTo(b);
        assertThat(PeriodUtils.min(a, a)).isEqualTo(a);
    }

    @Test
    void shouldCountInclusiveDaysWithinMonth() {
        assertThat(PeriodUtils.inclusiveDaysWithinMonth(
            LocalDate.of(2025, 2, 15), LocalDate.of(2025, 2, 28))).isEqualTo(14);
        assertThat(PeriodUtils.inclusiveDaysWithinMonth(
            LocalDate.of(2025, 3, 15), LocalDate.of(2025, 3, 15))).isEqualTo(1);
    }

    @Test
    void shouldExpressEveryMonthLengthAsWholeMonthUnits() {
        // 完整月份在任何月長度下都等於一個 MONTH_LENGTH_LCM
        for (int days = 28; days <= 31; days++) {
            assertThat(PeriodUtils.MONTH_LENGTH_LCM % days).isZero();
            assertThat(PeriodUtils.toMonthUnits(days, days)).isEqualTo(PeriodUtils.MONTH_LENGTH_LCM);
        }
        // 29/30 + 1/30 = 1
        assertThat(PeriodUtils.toMonthUnits(29, 30) + PeriodUtils.toMonthUnits(1, 30))
            .isEqualTo(PeriodUtils.MONTH_LENGTH_LCM);
    }

    @Test
    void shouldFormatMonths() {
        YearMonth month = YearMonth.of(2025, 2);

        assertThat(PeriodUtils.formatMonthLabel(month)).isEqualTo("Feb 2025");
        assertThat(PeriodUtils.formatPeriod(month)).isEqualTo("2025-02");
    }
}
