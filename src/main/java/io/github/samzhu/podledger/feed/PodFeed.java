package io.github.samzhu.podledger.feed;

import java.time.Duration;

/**
 * 叢集 Pod 清單與變更串流的提供者。
 */
public interface PodFeed {

    /**
     * 直接向叢集讀取完整清單（不經快取）。
     *
     * @throws io.github.samzhu.podledger.exception.ClusterSnapshotException 無法取得清單
     */
    PodSnapshot listAll();

    /**
     * 從指定位置訂閱變更串流。
     *
     * @param resourceVersion 串流位置，null 表示從目前開始
     * @param timeout 本次訂閱的時間上限
     */
    PodSubscription subscribe(String resourceVersion, Duration timeout);
}
