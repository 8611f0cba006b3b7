package personal.runqueue.engine.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.test.web.servlet.MockMvc;
import personal.runqueue.engine.adapter.in.web.filter.DequeueRateLimitFilter;
import personal.runqueue.engine.application.port.in.QueueIntrospectionUseCase;
import personal.runqueue.engine.domain.model.EnvironmentDescriptor;
import personal.runqueue.engine.domain.model.EnvironmentType;
import personal.runqueue.engine.domain.model.QueueMetrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(
        controllers = QueueMetricsController.class,
        excludeFilters = @ComponentScan.Filter(type = FilterType.ASSIGNABLE_TYPE, classes = DequeueRateLimitFilter.class))
@DisplayName("큐 메트릭 API 단위 테스트")
class QueueMetricsControllerTest {

    private static final String ENV_PATH = "/api/v1/run-queue/orgs/org1/projects/proj1/envs/env1";
    private static final EnvironmentDescriptor ENV =
            new EnvironmentDescriptor("org1", "proj1", "env1", EnvironmentType.PRODUCTION);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private QueueIntrospectionUseCase queueIntrospectionUseCase;

    @Test
    @DisplayName("큐 메트릭을 반환한다")
    void queueMetrics() throws Exception {
        // given
        given(queueIntrospectionUseCase.queueMetrics(ENV.queue("q1")))
                .willReturn(new QueueMetrics(4, 2, 10, 8, 1_500));

        // when & then
        mockMvc.perform(get(ENV_PATH + "/queues/q1/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length").value(4))
                .andExpect(jsonPath("$.data.capacity").value(8))
                .andExpect(jsonPath("$.data.oldestMessageAgeMs").value(1500));
    }

    @Test
    @DisplayName("여러 큐 길이를 요청 순서대로 반환한다")
    void lengthOfQueues() throws Exception {
        // given
        Map<String, Long> lengths = new LinkedHashMap<>();
        lengths.put("b", 2L);
        lengths.put("a", 0L);
        given(queueIntrospectionUseCase.lengthOfQueues(ENV, List.of("b", "a"))).willReturn(lengths);

        // when & then
        mockMvc.perform(get(ENV_PATH + "/queues/lengths").param("queues", "b", "a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.b").value(2))
                .andExpect(jsonPath("$.data.a").value(0));
    }

    @Test
    @DisplayName("queues 파라미터가 없으면 400")
    void lengthOfQueues_MissingParam() throws Exception {
        // when & then
        mockMvc.perform(get(ENV_PATH + "/queues/lengths"))
                .andExpect(status().isBadRequest());
    }
}
