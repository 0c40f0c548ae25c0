package personal.fitstudio.common.exception;

/**
 * 비즈니스 예외 최상위 클래스
 * ErrorCode와 상세 메시지, 실패가 발생한 처리 단계를 함께 전달
 */
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;
    private String failedStep;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getFailedStep() {
        return failedStep;
    }

    /**
     * 실패 단계 기록
     * 이미 기록된 단계는 덮어쓰지 않음 (가장 안쪽 단계 유지)
     */
    public BusinessException atStep(String step) {
        if (this.failedStep == null) {
            this.failedStep = step;
        }
        return this;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
