package io.github.samzhu.billing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;

import org.junit.jupiter.api.Test;

import io.github.samzhu.billing.dto.FractionResult;
import io.github.samzhu.billing.dto.MonthFragment;
import io.github.samzhu.billing.exception.InvalidRangeException;

class MonthFractionatorTest {

    private static final BigDecimal QTY = new BigDecimal("5");
    private static final BigDecimal PRICE = new BigDecimal("10");

    private final MonthFractionator fractionator = new MonthFractionator();

    @Test
    void shouldProduceSingleFragmentForSingleDay() {
        // Given
        LocalDate day = LocalDate.of(2025, 3, 15);

        // When
        FractionResult result = fractionator.fractionate(day, day, QTY, PRICE);

        // Then
        assertThat(result.fragments()).hasSize(1);
        MonthFragment fragment = result.fragments().get(0);
        assertThat(fragment.month()).isEqualTo(YearMonth.of(2025, 3));
        assertThat(fragment.activeDays()).isEqualTo(1);
        assertThat(fragment.totalDays()).isEqualTo(31);
        assertThat(fragment.fraction())
            .isEqualByComparingTo(BigDecimal.ONE.divide(new BigDecimal("31"), MathContext.DECIMAL128));
        assertThat(fragment.label()).isEqualTo("Mar 2025");
    }

    @Test
    void shouldSplitSpanAcrossMonthBoundary() {
        // Given: 2025-02-15 ~ 2025-03-01
        LocalDate start = LocalDate.of(2025, 2, 15);
        LocalDate end = LocalDate.of(2025, 3, 1);

        // When
        FractionResult result = fractionator.fractionate(start, end, QTY, PRICE);

        // Then
        // Feb: 14/28 = 0.5, Mar: 1/31
        assertThat(result.fragments()).hasSize(2);
        MonthFragment feb = result.fragments().get(0);
        assertThat(feb.activeDays()).isEqualTo(14);
        assertThat(feb.totalDays()).isEqualTo(28);
        assertThat(feb.fraction()).isEqualByComparingTo("0.5");
        assertThat(feb.partialUnits()).isEqualByComparingTo("2.5");
        assertThat(feb.partialAmount()).isEqualByComparingTo("25");

        MonthFragment mar = result.fragments().get(1);
        assertThat(mar.activeDays()).isEqualTo(1);
        assertThat(mar.totalDays()).isEqualTo(31);

        assertThat(result.quantityMonths().setScale(4, RoundingMode.HALF_UP))
            .isEqualByComparingTo("0.5323");
    }

    @Test
    void shouldUseLeapYearFebruaryLength() {
        // Given
        LocalDate start = LocalDate.of(2024, 2, 1);
        LocalDate end = LocalDate.of(2024, 2, 29);

        // When
        FractionResult result = fractionator.fractionate(start, end, QTY, PRICE);

        // Then
        assertThat(result.fragments()).singleElement()
            .satisfies(fragment -> {
                assertThat(fragment.totalDays()).isEqualTo(29);
                assertThat(fragment.activeDays()).isEqualTo(29);
                assertThat(fragment.fraction()).isEqualByComparingTo(BigDecimal.ONE);
            });
        assertThat(result.coversWholeMonths(1)).isTrue();
    }

    @Test
    void shouldSumWholeMonthsExactly() {
        // Given: Jun 2 ~ Sep 1 = 29/30 + 1 + 1 + 1/30
        LocalDate start = LocalDate.of(2025, 6, 2);
        LocalDate end = LocalDate.of(2025, 9, 1);

        // When
        FractionResult result = fractionator.fractionate(start, end, QTY, PRICE);

        // Then
        assertThat(result.coversWholeMonths(3)).isTrue();
        assertThat(result.quantityMonths()).isEqualByComparingTo("3");
    }

    @Test
    void shouldSupportMultiYearSpan() {
        // Given
        LocalDate start = LocalDate.of(2023, 11, 10);
        LocalDate end = LocalDate.of(2026, 2, 5);

        // When
        FractionResult result = fractionator.fractionate(start, end, QTY, PRICE);

        // Then: Nov 2023 ~ Feb 2026 = 28 months
        assertThat(result.fragments()).hasSize(28);
        assertThat(result.fragments().get(0).month()).isEqualTo(YearMonth.of(2023, 11));
        assertThat(result.fragments().get(27).month()).isEqualTo(YearMonth.of(2026, 2));
        assertThat(result.totalActiveDays()).isEqualTo(ChronoUnit.DAYS.between(start, end) + 1);
        assertThat(result.fragments())
            .allSatisfy(fragment -> {
                assertThat(fragment.fraction()).isPositive();
                assertThat(fragment.fraction()).isLessThanOrEqualTo(BigDecimal.ONE);
            });
    }

    @Test
    void shouldRoundTripDayCountsThroughFractions() {
        // Given
        LocalDate start = LocalDate.of(2024, 1, 17);
        LocalDate end = LocalDate.of(2024, 7, 3);

        // When
        FractionResult result = fractionator.fractionate(start, end, QTY, PRICE);

        // Then: sum(fraction × totalDays) == day count
        BigDecimal days = result.fragments().stream()
            .map(fragment -> fragment.fraction().multiply(BigDecimal.valueOf(fragment.totalDays())))
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(10, RoundingMode.HALF_UP);
        assertThat(days).isEqualByComparingTo(BigDecimal.valueOf(ChronoUnit.DAYS.between(start, end) + 1));
    }

    @Test
    void shouldRejectInvertedRange() {
        // Given
        LocalDate start = LocalDate.of(2025, 3, 2);
        LocalDate end = LocalDate.of(2025, 3, 1);

        // When/Then
        assertThatThrownBy(() -> fractionator.fractionate(start, end, QTY, PRICE))
            .isInstanceOf(InvalidRangeException.class)
            .hasMessageContaining("2025-03-02")
            .hasMessageContaining("2025-03-01");
    }
}
