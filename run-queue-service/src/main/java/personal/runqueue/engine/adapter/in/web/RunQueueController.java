package personal.runqueue.engine.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.runqueue.common.dto.ApiResponse;
import personal.runqueue.engine.adapter.in.web.dto.DequeueMessageRequest;
import personal.runqueue.engine.adapter.in.web.dto.DequeuedMessageResponse;
import personal.runqueue.engine.adapter.in.web.dto.EnqueueMessageRequest;
import personal.runqueue.engine.adapter.in.web.dto.NackMessageRequest;
import personal.runqueue.engine.adapter.in.web.dto.NackMessageResponse;
import personal.runqueue.engine.adapter.in.web.dto.QueueMessageResponse;
import personal.runqueue.engine.application.port.in.AcknowledgeMessageUseCase;
import personal.runqueue.engine.application.port.in.DequeueMessageUseCase;
import personal.runqueue.engine.application.port.in.EnqueueMessageUseCase;
import personal.runqueue.engine.application.port.in.MessageConcurrencyUseCase;
import personal.runqueue.engine.application.port.in.NackMessageUseCase;
import personal.runqueue.engine.application.port.in.QueueIntrospectionUseCase;
import personal.runqueue.engine.application.port.in.RedriveMessageUseCase;
import personal.runqueue.engine.domain.exception.MessageNotFoundException;
import personal.runqueue.engine.domain.model.NackResult;
import personal.runqueue.engine.domain.model.QueueMessage;

import java.util.List;

/**
 * Run Queue REST Controller
 * 메시지 등록 / dequeue / ack / nack / redrive / 동시성 예약 조정 엔드포인트
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/run-queue")
@RequiredArgsConstructor
@Validated
public class RunQueueController {

    private final EnqueueMessageUseCase enqueueMessageUseCase;
    private final DequeueMessageUseCase dequeueMessageUseCase;
    private final AcknowledgeMessageUseCase acknowledgeMessageUseCase;
    private final NackMessageUseCase nackMessageUseCase;
    private final RedriveMessageUseCase redriveMessageUseCase;
    private final QueueIntrospectionUseCase queueIntrospectionUseCase;
    private final MessageConcurrencyUseCase messageConcurrencyUseCase;

    /**
     * 메시지 등록
     * POST /api/v1/run-queue/messages
     */
    @PostMapping("/messages")
    public ResponseEntity<ApiResponse<Void>> enqueue(@Valid @RequestBody EnqueueMessageRequest request) {
        log.info("Enqueue request: orgId={}, envId={}, queue={}, messageId={}",
                request.orgId(), request.envId(), request.queue(), request.messageId());

        enqueueMessageUseCase.enqueue(request.toCommand());

        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(ApiResponse.success("메시지가 등록되었습니다."));
    }

    /**
     * 마스터 큐에서 메시지 점유
     * POST /api/v1/run-queue/dequeue
     */
    @PostMapping("/dequeue")
    public ResponseEntity<ApiResponse<List<DequeuedMessageResponse>>> dequeue(
            @Valid @RequestBody DequeueMessageRequest request) {

        log.debug("Dequeue request: masterQueue={}, consumerId={}, maxCount={}",
                request.masterQueue(), request.consumerId(), request.maxCount());

        List<DequeuedMessageResponse> response = dequeueMessageUseCase.dequeue(request.toCommand())
                .stream()
                .map(DequeuedMessageResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("메시지 dequeue 완료", response));
    }

    /**
     * 처리 완료
     * POST /api/v1/run-queue/messages/{orgId}/{messageId}/ack
     */
    @PostMapping("/messages/{orgId}/{messageId}/ack")
    public ResponseEntity<ApiResponse<Boolean>> acknowledge(
            @PathVariable String orgId,
            @PathVariable String messageId) {

        log.debug("Ack request: orgId={}, messageId={}", orgId, messageId);

        boolean acknowledged = acknowledgeMessageUseCase.acknowledge(orgId, messageId);
        String message = acknowledged ? "메시지 처리가 완료되었습니다." : "이미 처리되었거나 존재하지 않는 메시지입니다.";

        return ResponseEntity.ok(ApiResponse.success(message, acknowledged));
    }

    /**
     * 처리 실패 (재시도 또는 데드 레터)
     * POST /api/v1/run-queue/messages/{orgId}/{messageId}/nack
     */
    @PostMapping("/messages/{orgId}/{messageId}/nack")
    public ResponseEntity<ApiResponse<NackMessageResponse>> nack(
            @PathVariable String orgId,
            @PathVariable String messageId,
            @RequestBody(required = false) NackMessageRequest request) {

        log.debug("Nack request: orgId={}, messageId={}", orgId, messageId);

        NackMessageRequest body = request != null ? request : new NackMessageRequest(null, null, null);
        NackResult result = nackMessageUseCase.nack(body.toCommand(orgId, messageId));

        return ResponseEntity.ok(ApiResponse.success("메시지 nack 처리 완료", NackMessageResponse.from(result)));
    }

    /**
     * 메시지 조회
     * GET /api/v1/run-queue/messages/{orgId}/{messageId}
     */
    @GetMapping("/messages/{orgId}/{messageId}")
    public ResponseEntity<ApiResponse<QueueMessageResponse>> readMessage(
            @PathVariable String orgId,
            @PathVariable String messageId) {

        QueueMessage message = queueIntrospectionUseCase.readMessage(orgId, messageId)
                .orElseThrow(() -> new MessageNotFoundException(orgId, messageId));

        return ResponseEntity.ok(ApiResponse.success("메시지 조회 완료", QueueMessageResponse.from(message)));
    }

    /**
     * 데드 레터 여부 조회
     * GET /api/v1/run-queue/messages/{orgId}/{messageId}/dead-letter
     */
    @GetMapping("/messages/{orgId}/{messageId}/dead-letter")
    public ResponseEntity<ApiResponse<Boolean>> isDeadLettered(
            @PathVariable String orgId,
            @PathVariable String messageId) {

        boolean deadLettered = queueIntrospectionUseCase.messageInDeadLetterQueue(orgId, messageId);
        return ResponseEntity.ok(ApiResponse.success("데드 레터 여부 조회 완료", deadLettered));
    }

    /**
     * 데드 레터 메시지 재등록
     * POST /api/v1/run-queue/messages/{orgId}/{messageId}/redrive
     */
    @PostMapping("/messages/{orgId}/{messageId}/redrive")
    public ResponseEntity<ApiResponse<QueueMessageResponse>> redrive(
            @PathVariable String orgId,
            @PathVariable String messageId) {

        log.info("Redrive request: orgId={}, messageId={}", orgId, messageId);

        QueueMessage redriven = redriveMessageUseCase.redrive(orgId, messageId);
        return ResponseEntity.ok(ApiResponse.success("메시지가 재등록되었습니다.", QueueMessageResponse.from(redriven)));
    }

    /**
     * 모든 그룹의 동시성 예약 해제
     * POST /api/v1/run-queue/messages/{orgId}/{messageId}/concurrency/release
     */
    @PostMapping("/messages/{orgId}/{messageId}/concurrency/release")
    public ResponseEntity<ApiResponse<Boolean>> releaseAllConcurrency(
            @PathVariable String orgId,
            @PathVariable String messageId) {

        log.debug("Release concurrency request: orgId={}, messageId={}", orgId, messageId);

        boolean released = messageConcurrencyUseCase.releaseAllConcurrency(orgId, messageId);
        return ResponseEntity.ok(ApiResponse.success("동시성 예약 해제 완료", released));
    }

    /**
     * 환경 그룹의 동시성 예약 해제
     * POST /api/v1/run-queue/messages/{orgId}/{messageId}/concurrency/release-env
     */
    @PostMapping("/messages/{orgId}/{messageId}/concurrency/release-env")
    public ResponseEntity<ApiResponse<Boolean>> releaseEnvConcurrency(
            @PathVariable String orgId,
            @PathVariable String messageId) {

        log.debug("Release env concurrency request: orgId={}, messageId={}", orgId, messageId);

        boolean released = messageConcurrencyUseCase.releaseEnvConcurrency(orgId, messageId);
        return ResponseEntity.ok(ApiResponse.success("환경 동시성 예약 해제 완료", released));
    }

    /**
     * 동시성 재예약
     * POST /api/v1/run-queue/messages/{orgId}/{messageId}/concurrency/reacquire
     */
    @PostMapping("/messages/{orgId}/{messageId}/concurrency/reacquire")
    public ResponseEntity<ApiResponse<Boolean>> reacquireConcurrency(
            @PathVariable String orgId,
            @PathVariable String messageId) {

        log.debug("Reacquire concurrency request: orgId={}, messageId={}", orgId, messageId);

        boolean reacquired = messageConcurrencyUseCase.reacquireConcurrency(orgId, messageId);
        String message = reacquired ? "동시성 재예약 완료" : "동시성 한도에 도달했습니다.";
        return ResponseEntity.ok(ApiResponse.success(message, reacquired));
    }
}
