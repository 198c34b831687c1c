package io.github.samzhu.podledger.service;

import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import io.github.samzhu.podledger.config.PodLedgerProperties;

/**
 * 判斷命名空間是否在計費範圍外（系統與基礎設施工作負載）。
 */
@Component
public class NamespaceFilter {

    private final Set<String> ignored;
    private final List<String> ignoredPrefixes;

    public NamespaceFilter(PodLedgerProperties properties) {
        this.ignored = properties.namespaces().ignored();
        this.ignoredPrefixes = properties.namespaces().ignoredPrefixes();
    }

    /**
     * @param namespace 命名空間，null 視為不可計費
     * @return true 表示該命名空間的事件應在分類前丟棄
     */
    public boolean isIgnored(String namespace) {
        if (namespace == null) {
            return true;
        }
        if (ignored.contains(namespace)) {
            return true;
        }
        return ignoredPrefixes.stream().anyMatch(namespace::startsWith);
    }
}
