package personal.runqueue.engine.application.port.in;

/**
 * 런 큐 종료 UseCase
 */
public interface RunQueueLifecycleUseCase {

    /**
     * 연결을 반납합니다. 이후의 모든 연산은 RunQueueClosedException을 던집니다.
     */
    void quit();

    boolean isClosed();
}
