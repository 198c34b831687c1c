package io.github.samzhu.podledger.exception;

/**
 * Pod 事件串流的傳輸或 API 錯誤（非 410 Gone）。
 *
 * <p>串流協調器記錄後重設 token 並重新訂閱，程序持續運行。
 */
public class FeedTransportException extends RuntimeException {

    public FeedTransportException(String message) {
        super(message);
    }

    public FeedTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
