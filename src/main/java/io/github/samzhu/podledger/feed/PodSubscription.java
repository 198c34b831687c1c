package io.github.samzhu.podledger.feed;

import java.util.Iterator;

import io.github.samzhu.podledger.dto.PodEvent;

/**
 * 單次訂閱的事件序列。
 *
 * <p>有限：逾時、連線關閉或呼叫 {@link #close()} 後結束。
 * {@link #hasNext()} 會阻塞直到下一個事件或序列結束；
 * 串流位置失效時拋出 {@link io.github.samzhu.podledger.exception.FeedPositionExpiredException}，
 * 其他串流錯誤拋出 {@link io.github.samzhu.podledger.exception.FeedTransportException}。
 *
 * <p>{@link #close()} 可由其他執行緒呼叫，用於關閉程序。
 */
public interface PodSubscription extends Iterator<PodEvent>, AutoCloseable {

    @Override
    void close();
}
