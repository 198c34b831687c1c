package io.github.samzhu.podledger.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link PodLedgerProperties} 的型別安全配置綁定，並提供 UTC {@link Clock}，
 * 估算結束時間與對帳時間皆由此取得，測試可替換為固定時鐘。
 *
 * @see PodLedgerProperties
 */
@Configuration
@EnableConfigurationProperties(PodLedgerProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
