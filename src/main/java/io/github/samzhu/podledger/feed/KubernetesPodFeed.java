package io.github.samzhu.podledger.feed;

import java.net.HttpURLConnection;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.fabric8.kubernetes.api.model.ListOptions;
import io.fabric8.kubernetes.api.model.ListOptionsBuilder;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.Watch;
import io.github.samzhu.podledger.dto.WorkloadInstance;
import io.github.samzhu.podledger.exception.ClusterSnapshotException;
import io.github.samzhu.podledger.exception.FeedPositionExpiredException;
import io.github.samzhu.podledger.exception.FeedTransportException;

/**
 * 以 fabric8 Kubernetes 用戶端實作的 Pod 清單與 watch 串流，涵蓋所有命名空間。
 *
 * <p>清單直接呼叫 API server（不使用 informer 快取），確保對帳依據的是叢集現況。
 * 無法轉換的單一 Pod（缺少 metadata、時間格式錯誤）記錄後略過，不影響其餘清單。
 * watch 啟用 bookmark，讓閒置時也能推進 resourceVersion。
 *
 * @see <a href="https://kubernetes.io/docs/reference/using-api/api-concepts/#efficient-detection-of-changes">Efficient detection of changes</a>
 */
@Component
public class KubernetesPodFeed implements PodFeed {

    private static final Logger log = LoggerFactory.getLogger(KubernetesPodFeed.class);

    private final KubernetesClient client;
    private final PodMapper mapper;

    public KubernetesPodFeed(KubernetesClient client, PodMapper mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    @Override
    public PodSnapshot listAll() {
        PodList list;
        try {
            list = client.pods().inAnyNamespace().list();
        } catch (KubernetesClientException e) {
            throw new ClusterSnapshotException("Failed to list pods in all namespaces", e);
        }

        List<WorkloadInstance> items = new ArrayList<>();
        int skipped = 0;
        for (Pod pod : list.getItems()) {
            try {
                items.add(mapper.toInstance(pod));
            } catch (RuntimeException e) {
                skipped++;
                ObjectMeta metadata = pod.getMetadata();
                log.error("Skipping unreadable pod in listing: pod={}/{}: {}",
                    metadata != null ? metadata.getNamespace() : null,
                    metadata != null ? metadata.getName() : null,
                    e.getMessage(), e);
            }
        }
        String resourceVersion = list.getMetadata() != null ? list.getMetadata().getResourceVersion() : null;

        log.info("Listed {} pods at resourceVersion={} (skipped={})", items.size(), resourceVersion, skipped);
        return new PodSnapshot(items, resourceVersion);
    }

    @Override
    public PodSubscription subscribe(String resourceVersion, Duration timeout) {
        PodWatchQueue subscription = new PodWatchQueue(mapper, resourceVersion, timeout);
        ListOptions options = new ListOptionsBuilder()
            .withResourceVersion(resourceVersion)
            .withAllowWatchBookmarks(true)
            .build();

        try {
            Watch watch = client.pods().inAnyNamespace().watch(options, subscription);
            subscription.attach(watch);
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_GONE) {
                throw new FeedPositionExpiredException(resourceVersion, e);
            }
            throw new FeedTransportException("Failed to open pod watch", e);
        }

        log.debug("Subscribed to pod events: resourceVersion={}, timeout={}", resourceVersion, timeout);
        return subscription;
    }
}
