package personal.runqueue.engine.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.runqueue.engine.adapter.in.web.filter.DequeueRateLimitFilter;
import personal.runqueue.engine.application.port.in.AcknowledgeMessageUseCase;
import personal.runqueue.engine.application.port.in.DequeueMessageUseCase;
import personal.runqueue.engine.application.port.in.EnqueueMessageUseCase;
import personal.runqueue.engine.application.port.in.EnqueueMessageUseCase.EnqueueMessageCommand;
import personal.runqueue.engine.application.port.in.MessageConcurrencyUseCase;
import personal.runqueue.engine.application.port.in.NackMessageUseCase;
import personal.runqueue.engine.application.port.in.NackMessageUseCase.NackMessageCommand;
import personal.runqueue.engine.application.port.in.QueueIntrospectionUseCase;
import personal.runqueue.engine.application.port.in.RedriveMessageUseCase;
import personal.runqueue.engine.domain.exception.MessageNotFoundException;
import personal.runqueue.engine.domain.exception.MessageNotInDeadLetterException;
import personal.runqueue.engine.domain.model.DequeuedMessage;
import personal.runqueue.engine.domain.model.EnvironmentDescriptor;
import personal.runqueue.engine.domain.model.EnvironmentType;
import personal.runqueue.engine.domain.model.NackResult;
import personal.runqueue.engine.domain.model.QueueMessage;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(
        controllers = RunQueueController.class,
        excludeFilters = @ComponentScan.Filter(type = FilterType.ASSIGNABLE_TYPE, classes = DequeueRateLimitFilter.class))
@DisplayName("Run Queue API 단위 테스트")
class RunQueueControllerTest {

    private static final EnvironmentDescriptor ENV =
            new EnvironmentDescriptor("org1", "proj1", "env1", EnvironmentType.PRODUCTION);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EnqueueMessageUseCase enqueueMessageUseCase;

    @MockBean
    private DequeueMessageUseCase dequeueMessageUseCase;

    @MockBean
    private AcknowledgeMessageUseCase acknowledgeMessageUseCase;

    @MockBean
    private NackMessageUseCase nackMessageUseCase;

    @MockBean
    private RedriveMessageUseCase redriveMessageUseCase;

    @MockBean
    private QueueIntrospectionUseCase queueIntrospectionUseCase;

    @MockBean
    private MessageConcurrencyUseCase messageConcurrencyUseCase;

    private QueueMessage message() {
        return QueueMessage.create(ENV, "q1", "m1", "{}", List.of("main"), 1_000L);
    }

    @Test
    @DisplayName("메시지 등록은 201을 반환한다")
    void enqueue_Created() throws Exception {
        // given
        String body = """
                {"orgId":"org1","projectId":"proj1","envId":"env1","envType":"PRODUCTION",
                 "queue":"q1","messageId":"m1","payload":"{}","masterQueues":["main"]}
                """;

        // when & then
        mockMvc.perform(post("/api/v1/run-queue/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.result").value("success"));

        then(enqueueMessageUseCase).should().enqueue(argThat((EnqueueMessageCommand command) ->
                command.messageId().equals("m1") && command.env().equals(ENV) && command.timestamp() == null));
    }

    @Test
    @DisplayName("마스터 큐가 없으면 400")
    void enqueue_MissingMasterQueues() throws Exception {
        // given
        String body = """
                {"orgId":"org1","projectId":"proj1","envId":"env1","envType":"PRODUCTION",
                 "queue":"q1","messageId":"m1","masterQueues":[]}
                """;

        // when & then
        mockMvc.perform(post("/api/v1/run-queue/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));

        then(enqueueMessageUseCase).should(never()).enqueue(any());
    }

    @Test
    @DisplayName("dequeue는 점유한 메시지 목록을 반환한다")
    void dequeue_ReturnsMessages() throws Exception {
        // given
        given(dequeueMessageUseCase.dequeue(any()))
                .willReturn(List.of(new DequeuedMessage("m1", "runqueue:q1", 1_000L, message())));

        // when & then
        mockMvc.perform(post("/api/v1/run-queue/dequeue")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"consumerId\":\"c1\",\"masterQueue\":\"main\",\"maxCount\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].messageId").value("m1"))
                .andExpect(jsonPath("$.data[0].message.queue").value("q1"));
    }

    @Test
    @DisplayName("nack 본문 없이 호출하면 기본 재시도 명령으로 처리한다")
    void nack_WithoutBody() throws Exception {
        // given
        given(nackMessageUseCase.nack(any())).willReturn(NackResult.requeued(1, 5_000L));

        // when & then
        mockMvc.perform(post("/api/v1/run-queue/messages/org1/m1/nack"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.outcome").value("REQUEUED"))
                .andExpect(jsonPath("$.data.attempt").value(1))
                .andExpect(jsonPath("$.data.retryAt").value(5000));

        then(nackMessageUseCase).should().nack(argThat((NackMessageCommand command) ->
                command.incrementAttempt() && command.retryAt() == null));
    }

    @Test
    @DisplayName("없는 메시지 조회는 404")
    void readMessage_NotFound() throws Exception {
        // given
        given(queueIntrospectionUseCase.readMessage("org1", "missing")).willReturn(Optional.empty());

        // when & then
        mockMvc.perform(get("/api/v1/run-queue/messages/org1/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("R003"));
    }

    @Test
    @DisplayName("데드 레터에 없는 메시지 redrive는 409")
    void redrive_NotInDeadLetter() throws Exception {
        // given
        given(redriveMessageUseCase.redrive("org1", "m1"))
                .willThrow(new MessageNotInDeadLetterException("org1", "m1"));

        // when & then
        mockMvc.perform(post("/api/v1/run-queue/messages/org1/m1/redrive"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("ack 결과를 그대로 data에 담는다")
    void ack_ReturnsResult() throws Exception {
        // given
        given(acknowledgeMessageUseCase.acknowledge("org1", "m1")).willReturn(true);

        // when & then
        mockMvc.perform(post("/api/v1/run-queue/messages/org1/m1/ack"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(true));
    }

    @Test
    @DisplayName("저장소 연결 실패는 503 BACKING_STORE_ERROR")
    void ack_BackingStoreUnavailable() throws Exception {
        // given
        given(acknowledgeMessageUseCase.acknowledge("org1", "m1"))
                .willThrow(new RedisConnectionFailureException("connection refused"));

        // when & then
        mockMvc.perform(post("/api/v1/run-queue/messages/org1/m1/ack"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("E001"));
    }

    @Test
    @DisplayName("동시성 예약 해제 결과를 data에 담는다")
    void releaseAllConcurrency_ReturnsResult() throws Exception {
        // given
        given(messageConcurrencyUseCase.releaseAllConcurrency("org1", "m1")).willReturn(true);

        // when & then
        mockMvc.perform(post("/api/v1/run-queue/messages/org1/m1/concurrency/release"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(true));
    }

    @Test
    @DisplayName("환경 동시성만 해제한다")
    void releaseEnvConcurrency_DelegatesToEnvRelease() throws Exception {
        // given
        given(messageConcurrencyUseCase.releaseEnvConcurrency("org1", "m1")).willReturn(true);

        // when & then
        mockMvc.perform(post("/api/v1/run-queue/messages/org1/m1/concurrency/release-env"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(true));

        then(messageConcurrencyUseCase).should(never()).releaseAllConcurrency(any(), any());
    }

    @Test
    @DisplayName("가득 찬 그룹이 있으면 재예약 결과는 false")
    void reacquireConcurrency_AtCapacity() throws Exception {
        // given
        given(messageConcurrencyUseCase.reacquireConcurrency("org1", "m1")).willReturn(false);

        // when & then
        mockMvc.perform(post("/api/v1/run-queue/messages/org1/m1/concurrency/reacquire"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(false));
    }

    @Test
    @DisplayName("없는 메시지 재예약은 404")
    void reacquireConcurrency_NotFound() throws Exception {
        // given
        given(messageConcurrencyUseCase.reacquireConcurrency("org1", "missing"))
                .willThrow(new MessageNotFoundException("org1", "missing"));

        // when & then
        mockMvc.perform(post("/api/v1/run-queue/messages/org1/missing/concurrency/reacquire"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("R003"));
    }
}
