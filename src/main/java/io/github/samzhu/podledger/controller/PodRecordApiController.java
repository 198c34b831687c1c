package io.github.samzhu.podledger.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.podledger.document.PodRecord;
import io.github.samzhu.podledger.dto.api.EndTimeCorrectionRequest;
import io.github.samzhu.podledger.dto.api.LedgerStatusResponse;
import io.github.samzhu.podledger.repository.PodRecordRepository;
import io.github.samzhu.podledger.store.CorrectionOutcome;
import io.github.samzhu.podledger.store.PodLedgerStore;

/**
 * Pod 計費記錄查詢與稽核 API。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code GET /api/v1/pods?state=open|closed|estimated} - 依狀態查詢記錄</li>
 *   <li>{@code GET /api/v1/pods/status} - 帳本統計</li>
 *   <li>{@code GET /api/v1/pods/namespaces/{namespace}} - 命名空間的記錄</li>
 *   <li>{@code GET /api/v1/pods/{uid}} - 單筆記錄</li>
 *   <li>{@code POST /api/v1/pods/{uid}/end-time-correction} - 明確修正已結束記錄的結束時間</li>
 * </ul>
 *
 * <p>此 API 不存取記憶體中的計費索引；計費中的記錄歸串流執行緒所有，不可修正。
 */
@RestController
@RequestMapping("/api/v1/pods")
public class PodRecordApiController {

    private static final Logger log = LoggerFactory.getLogger(PodRecordApiController.class);

    private final PodRecordRepository podRecordRepository;
    private final PodLedgerStore store;

    public PodRecordApiController(PodRecordRepository podRecordRepository, PodLedgerStore store) {
        this.podRecordRepository = podRecordRepository;
        this.store = store;
    }

    /**
     * 依狀態查詢記錄。
     *
     * @param state {@code open}（預設）、{@code closed} 或 {@code estimated}
     * @return 記錄清單；狀態不合法時回傳 400
     */
    @GetMapping
    public ResponseEntity<List<PodRecord>> listRecords(@RequestParam(defaultValue = "open") String state) {
        log.debug("API request: listRecords state={}", state);

        List<PodRecord> records = switch (state) {
            case "open" -> podRecordRepository.findByEndTimeIsNullOrderByStartTimeAsc();
            case "closed" -> podRecordRepository.findByEndTimeIsNotNullOrderByEndTimeDesc();
            case "estimated" -> store.listEstimated();
            default -> null;
        };
        if (records == null) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(records);
    }

    @GetMapping("/status")
    public ResponseEntity<LedgerStatusResponse> getStatus() {
        return ResponseEntity.ok(new LedgerStatusResponse(
            podRecordRepository.countByEndTimeIsNull(),
            podRecordRepository.countByEndTimeIsNotNull(),
            podRecordRepository.countByEndTimeEstimatedTrue()));
    }

    @GetMapping("/namespaces/{namespace}")
    public ResponseEntity<List<PodRecord>> listByNamespace(@PathVariable String namespace) {
        return ResponseEntity.ok(podRecordRepository.findByNamespaceOrderByStartTimeAsc(namespace));
    }

    @GetMapping("/{uid}")
    public ResponseEntity<PodRecord> getRecord(@PathVariable String uid) {
        return store.getRecord(uid)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * 修正已結束記錄的結束時間。
     *
     * @param uid Pod UID
     * @param request 新的結束時間、估算旗標與修正原因
     * @return 修正後的記錄；不存在回傳 404，仍在計費或同時被修改回傳 409
     */
    @PostMapping("/{uid}/end-time-correction")
    public ResponseEntity<PodRecord> correctEndTime(
            @PathVariable String uid,
            @Validated @RequestBody EndTimeCorrectionRequest request) {

        log.info("API request: correctEndTime uid={}, endTime={}, estimated={}, reason='{}'",
            uid, request.endTime(), request.estimated(), request.reason());

        CorrectionOutcome outcome = store.correctEndTime(uid, request.endTime(), request.estimated(), request.reason());
        return switch (outcome) {
            case CORRECTED -> store.getRecord(uid)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
            case NOT_FOUND -> ResponseEntity.notFound().build();
            case STILL_OPEN, CONFLICT -> ResponseEntity.status(HttpStatus.CONFLICT).build();
        };
    }
}
