package io.github.samzhu.billing.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link BillingProperties} 的型別安全配置綁定，
 * 使計費服務可以透過 constructor injection 取得捨入與日誌設定。
 *
 * @see BillingProperties
 */
@Configuration
@EnableConfigurationProperties(BillingProperties.class)
public class AppConfig {
}
