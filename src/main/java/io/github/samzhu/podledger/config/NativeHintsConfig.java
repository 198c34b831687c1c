package io.github.samzhu.podledger.config;

import org.springframework.aot.hint.MemberCategory;
import org.springframework.aot.hint.RuntimeHints;
import org.springframework.aot.hint.RuntimeHintsRegistrar;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.ImportRuntimeHints;

import io.github.samzhu.podledger.document.PodRecord;
import io.github.samzhu.podledger.dto.api.EndTimeCorrectionRequest;
import io.github.samzhu.podledger.dto.api.LedgerStatusResponse;

/**
 * GraalVM Native Image 執行時期提示配置。
 *
 * <p>註冊需要反射存取的類別：
 * <ul>
 *   <li>{@link PodRecord} - MongoDB 文件，同時作為 API 回應序列化</li>
 *   <li>API DTO - Jackson 序列化/反序列化</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/native-image/introducing-graalvm-native-images.html">Spring Boot Native Image Support</a>
 */
@Configuration
@ImportRuntimeHints(NativeHintsConfig.PodLedgerRuntimeHints.class)
public class NativeHintsConfig {

    static class PodLedgerRuntimeHints implements RuntimeHintsRegistrar {

        @Override
        public void registerHints(RuntimeHints hints, ClassLoader classLoader) {
            hints.reflection()
                .registerType(PodRecord.class, MemberCategory.values())
                .registerType(LedgerStatusResponse.class, MemberCategory.values())
                .registerType(EndTimeCorrectionRequest.class, MemberCategory.values());
        }
    }
}
