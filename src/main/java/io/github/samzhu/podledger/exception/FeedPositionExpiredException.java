package io.github.samzhu.podledger.exception;

/**
 * Watch 的 resourceVersion 已在伺服器端失效 (HTTP 410 Gone)。
 *
 * <p>串流協調器收到此異常後會重設 resumption token 並重新訂閱，永不致命。
 */
public class FeedPositionExpiredException extends RuntimeException {

    private final String resourceVersion;

    public FeedPositionExpiredException(String resourceVersion, Throwable cause) {
        super(String.format("Watch position expired: resourceVersion='%s'", resourceVersion), cause);
        this.resourceVersion = resourceVersion;
    }

    public String getResourceVersion() {
        return resourceVersion;
    }
}
