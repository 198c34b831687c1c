package io.github.samzhu.podledger.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * MongoDB 資料庫配置。
 *
 * <p>啟用 Repository 自動掃描，註冊 {@code io.github.samzhu.podledger.repository} 下的介面。
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code pod_records} - 每個 Pod 一筆計費記錄</li>
 * </ul>
 *
 * <p>連線位置由 {@code spring.data.mongodb.uri} 設定。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/configuration.html">Spring Data MongoDB Configuration</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.podledger.repository")
public class MongoConfig {
}
