package io.github.samzhu.podledger.store;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import com.mongodb.client.result.UpdateResult;

import io.github.samzhu.podledger.document.PodRecord;
import io.github.samzhu.podledger.dto.ResourceRequest;
import io.github.samzhu.podledger.repository.PodRecordRepository;

/**
 * 以 MongoDB {@code pod_records} 集合實作的計費帳本。
 *
 * <p>寫入策略：
 * <ul>
 *   <li>建立使用 upsert + {@code $setOnInsert}，重複 UID 不改變既有文件</li>
 *   <li>關閉使用條件更新 {@code {_id, endTime: null}}，已關閉的記錄不會被覆寫</li>
 *   <li>修正使用樂觀比對（讀取時的 endTime），並保留修正前的值</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/template-update.html">Spring Data MongoDB Update Operations</a>
 */
@Component
public class MongoPodLedgerStore implements PodLedgerStore {

    private static final Logger log = LoggerFactory.getLogger(MongoPodLedgerStore.class);

    private final MongoTemplate mongoTemplate;
    private final PodRecordRepository podRecordRepository;
    private final Clock clock;

    public MongoPodLedgerStore(MongoTemplate mongoTemplate, PodRecordRepository podRecordRepository, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.podRecordRepository = podRecordRepository;
        this.clock = clock;
    }

    @Override
    public boolean createIfAbsent(String uid, String namespace, String name, String node,
                                  ResourceRequest resources, Instant startTime) {
        PodRecord record = PodRecord.open(uid, namespace, name, node, resources, startTime, clock.instant());
        Query query = Query.query(Criteria.where("_id").is(uid));
        Update update = new Update()
            .setOnInsert("namespace", record.namespace())
            .setOnInsert("name", record.name())
            .setOnInsert("node", record.node())
            .setOnInsert("cpu", record.cpu())
            .setOnInsert("memory", record.memory())
            .setOnInsert("accelerator", record.accelerator())
            .setOnInsert("startTime", record.startTime())
            .setOnInsert("endTime", record.endTime())
            .setOnInsert("endTimeEstimated", record.endTimeEstimated())
            .setOnInsert("createdAt", record.createdAt());

        UpdateResult result = mongoTemplate.upsert(query, update, PodRecord.class);
        boolean created = result.getUpsertedId() != null;
        if (!created) {
            log.debug("Record already exists, create skipped: uid={}", uid);
        }
        return created;
    }

    @Override
    public boolean setEndTime(String uid, Instant endTime, boolean estimated) {
        long updated = podRecordRepository.closeIfOpen(uid, endTime, estimated);
        if (updated > 0) {
            return true;
        }

        Optional<PodRecord> existing = podRecordRepository.findById(uid);
        if (existing.isEmpty()) {
            log.error("Cannot set end time, no record: uid={}", uid);
        } else {
            PodRecord record = existing.get();
            log.warn("Refusing to overwrite end time: uid={}, existing={} (estimated={}), attempted={} (estimated={})",
                uid, record.endTime(), record.endTimeEstimated(), endTime, estimated);
        }
        return false;
    }

    @Override
    public CorrectionOutcome correctEndTime(String uid, Instant endTime, boolean estimated, String reason) {
        Optional<PodRecord> existing = podRecordRepository.findById(uid);
        if (existing.isEmpty()) {
            return CorrectionOutcome.NOT_FOUND;
        }
        PodRecord record = existing.get();
        if (record.isOpen()) {
            return CorrectionOutcome.STILL_OPEN;
        }

        Query query = Query.query(Criteria.where("_id").is(uid)
            .and("endTime").is(record.endTime())
            .and("endTimeEstimated").is(record.endTimeEstimated()));
        PodRecord corrected = record.withCorrection(endTime, estimated, reason, clock.instant());
        Update update = new Update()
            .set("endTime", corrected.endTime())
            .set("endTimeEstimated", corrected.endTimeEstimated())
            .set("previousEndTime", corrected.previousEndTime())
            .set("previousEndTimeEstimated", corrected.previousEndTimeEstimated())
            .set("correctionReason", corrected.correctionReason())
            .set("correctedAt", corrected.correctedAt());

        UpdateResult result = mongoTemplate.updateFirst(query, update, PodRecord.class);
        if (result.getModifiedCount() == 0) {
            log.warn("End time correction conflicted with a concurrent write: uid={}", uid);
            return CorrectionOutcome.CONFLICT;
        }

        log.warn("End time corrected: uid={}, {} (estimated={}) -> {} (estimated={}), reason='{}'",
            uid, record.endTime(), record.endTimeEstimated(), endTime, estimated, reason);
        return CorrectionOutcome.CORRECTED;
    }

    @Override
    public Set<String> listOpenIds() {
        return findIds(Criteria.where("endTime").is(null));
    }

    @Override
    public Set<String> listClosedIds() {
        return findIds(Criteria.where("endTime").ne(null));
    }

    @Override
    public Optional<PodRecord> getRecord(String uid) {
        return podRecordRepository.findById(uid);
    }

    @Override
    public List<PodRecord> listEstimated() {
        return podRecordRepository.findByEndTimeEstimatedTrueOrderByEndTimeDesc();
    }

    private Set<String> findIds(Criteria criteria) {
        List<String> ids = mongoTemplate.findDistinct(Query.query(criteria), "_id", PodRecord.class, String.class);
        return new HashSet<>(ids);
    }
}
