package personal.runqueue.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Run Queue Service Application
 * Redis 기반 공정 분배 / 동시성 제어 작업 큐
 */
@SpringBootApplication(
    scanBasePackages = {
        "personal.runqueue.engine",
        "personal.runqueue.common"  // GlobalExceptionHandler, HealthCheckService
    }
)
public class RunQueueApplication {
    public static void main(String[] args) {
        SpringApplication.run(RunQueueApplication.class, args);
    }
}
