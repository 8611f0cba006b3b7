package personal.runqueue.engine.domain.model;

/**
 * 실행 환경 유형
 */
public enum EnvironmentType {
    PRODUCTION,
    STAGING,
    DEVELOPMENT,
    PREVIEW
}
