package io.github.samzhu.billing.config;

import java.math.RoundingMode;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 計費排程服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link RoundingConfig} - 輸出時的四捨五入設定 (僅影響呈現，計算一律使用完整精度)</li>
 *   <li>{@link ReportConfig} - 排程摘要日誌輸出設定</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * billing:
 *   rounding:
 *     quantity-scale: 4
 *     amount-scale: 2
 *     mode: HALF_UP
 *   report:
 *     log-periods: true
 *     currency-symbol: "₹"
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "billing")
public record BillingProperties(
    RoundingConfig rounding,
    ReportConfig report
) {
    public BillingProperties {
        if (rounding == null) {
            rounding = RoundingConfig.defaults();
        }
        if (report == null) {
            report = ReportConfig.defaults();
        }
    }

    /**
     * 建立全部使用預設值的配置。
     */
    public static BillingProperties defaults() {
        return new BillingProperties(RoundingConfig.defaults(), ReportConfig.defaults());
    }

    /**
     * 輸出四捨五入設定。
     *
     * <p>月份比例、數量、計費單位使用 {@code quantityScale} 位小數，
     * 金額使用 {@code amountScale} 位小數。
     *
     * @param quantityScale 數量類欄位的小數位數，預設 4
     * @param amountScale 金額欄位的小數位數，預設 2
     * @param mode 捨入模式，預設 HALF_UP
     */
    public record RoundingConfig(
        int quantityScale,
        int amountScale,
        RoundingMode mode
    ) {
        public RoundingConfig {
            if (quantityScale <= 0) {
                quantityScale = 4;
            }
            if (amountScale <= 0) {
                amountScale = 2;
            }
            if (mode == null) {
                mode = RoundingMode.HALF_UP;
            }
        }

        /**
         * 建立預設捨入設定。
         */
        public static RoundingConfig defaults() {
            return new RoundingConfig(4, 2, RoundingMode.HALF_UP);
        }
    }

    /**
     * 排程摘要日誌設定。
     *
     * @param logPeriods 是否在產生排程後逐期輸出摘要日誌
     * @param currencySymbol 日誌中金額前綴的貨幣符號，僅用於顯示
     */
    public record ReportConfig(
        boolean logPeriods,
        String currencySymbol
    ) {
        public ReportConfig {
            if (currencySymbol == null) {
                currencySymbol = "₹";
            }
        }

        /**
         * 建立預設日誌設定 (啟用逐期摘要)。
         */
        public static ReportConfig defaults() {
            return new ReportConfig(true, "₹");
        }
    }
}
