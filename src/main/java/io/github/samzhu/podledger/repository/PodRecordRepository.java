package io.github.samzhu.podledger.repository;

import java.time.Instant;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;

import io.github.samzhu.podledger.document.PodRecord;

/**
 * Pod 計費記錄資料存取介面。
 *
 * <p>提供對 {@code pod_records} 集合的查詢。寫入由
 * {@link io.github.samzhu.podledger.store.MongoPodLedgerStore} 負責，
 * 確保結束時間不會被靜默覆寫。
 *
 * @see io.github.samzhu.podledger.document.PodRecord
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/repositories/query-methods.html">Query Methods</a>
 */
public interface PodRecordRepository extends MongoRepository<PodRecord, String> {

    // ========== 基本查詢 (Derived Query Methods) ==========

    /**
     * 查詢計費中的記錄。
     *
     * @return 尚無結束時間的記錄，依開始時間升序
     */
    List<PodRecord> findByEndTimeIsNullOrderByStartTimeAsc();

    /**
     * 查詢已結束的記錄。
     *
     * @return 已有結束時間的記錄，依結束時間降序
     */
    List<PodRecord> findByEndTimeIsNotNullOrderByEndTimeDesc();

    /**
     * 查詢結束時間為估算值的記錄（稽核用）。
     *
     * @return 估算結束時間的記錄，依結束時間降序
     */
    List<PodRecord> findByEndTimeEstimatedTrueOrderByEndTimeDesc();

    /**
     * 查詢指定命名空間的記錄。
     *
     * @param namespace 命名空間
     * @return 該命名空間的記錄，依開始時間升序
     */
    List<PodRecord> findByNamespaceOrderByStartTimeAsc(String namespace);

    long countByEndTimeIsNull();

    long countByEndTimeIsNotNull();

    long countByEndTimeEstimatedTrue();

    // ========== 更新操作 (@Query + @Update) ==========

    /**
     * 關閉計費中的記錄。
     *
     * <p>只比對 {@code endTime} 為 null 的文件，已關閉的記錄不會被覆寫。
     *
     * @param uid Pod UID
     * @param endTime 結束時間
     * @param estimated 是否為估算值
     * @return 更新的文件數（0 或 1）
     */
    @Query("{ '_id': ?0, 'endTime': null }")
    @Update("{ '$set': { 'endTime': ?1, 'endTimeEstimated': ?2 } }")
    long closeIfOpen(String uid, Instant endTime, boolean estimated);
}
