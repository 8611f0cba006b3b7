package personal.runqueue.engine.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.runqueue.common.dto.ApiResponse;
import personal.runqueue.engine.adapter.in.web.dto.WorkerQueuePushRequest;
import personal.runqueue.engine.application.port.in.WorkerQueueUseCase;
import personal.runqueue.engine.domain.model.WorkerQueuePopResult;

import java.util.List;

/**
 * Worker Queue REST Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/worker-queues/{workerId}")
@RequiredArgsConstructor
@Validated
public class WorkerQueueController {

    private final WorkerQueueUseCase workerQueueUseCase;

    @PostMapping
    public ResponseEntity<ApiResponse<Void>> push(
            @PathVariable String workerId,
            @Valid @RequestBody WorkerQueuePushRequest request) {

        workerQueueUseCase.pushBatch(workerId, request.entries());
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(ApiResponse.success("워커 큐에 추가되었습니다."));
    }

    @PostMapping("/pop")
    public ResponseEntity<ApiResponse<WorkerQueuePopResult>> pop(@PathVariable String workerId) {
        WorkerQueuePopResult result = workerQueueUseCase.pop(workerId).orElse(null);
        String message = result != null ? "워커 큐 pop 완료" : "워커 큐가 비어 있습니다.";
        return ResponseEntity.ok(ApiResponse.success(message, result));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<String>>> peek(@PathVariable String workerId) {
        return ResponseEntity.ok(ApiResponse.success("워커 큐 조회 완료", workerQueueUseCase.peek(workerId)));
    }

    @GetMapping("/length")
    public ResponseEntity<ApiResponse<Long>> length(@PathVariable String workerId) {
        return ResponseEntity.ok(ApiResponse.success("워커 큐 길이 조회 완료", workerQueueUseCase.getLength(workerId)));
    }

    /**
     * DELETE /api/v1/worker-queues/{workerId}/entries?entry=...
     */
    @DeleteMapping("/entries")
    public ResponseEntity<ApiResponse<Long>> remove(
            @PathVariable String workerId,
            @RequestParam @NotBlank String entry) {

        long removed = workerQueueUseCase.remove(workerId, entry);
        return ResponseEntity.ok(ApiResponse.success("워커 큐 항목이 제거되었습니다.", removed));
    }

    @DeleteMapping
    public ResponseEntity<ApiResponse<Void>> clear(@PathVariable String workerId) {
        log.info("Clear worker queue request: workerId={}", workerId);
        workerQueueUseCase.clear(workerId);
        return ResponseEntity.ok(ApiResponse.success("워커 큐가 비워졌습니다."));
    }
}
