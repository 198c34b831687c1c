package io.github.samzhu.podledger.exception;

/**
 * 無法取得叢集完整 Pod 清單。
 *
 * <p>啟動對帳時發生此異常為致命錯誤：本地狀態未修復前不得進入串流階段，
 * Spring context 啟動失敗，程序以非零狀態結束。
 */
public class ClusterSnapshotException extends RuntimeException {

    public ClusterSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
