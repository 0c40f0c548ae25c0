package personal.fitstudio.common.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 에러 응답 포맷
 *
 * @param code      에러 코드 (예: S005)
 * @param message   사용자 메시지
 * @param detail    상세 메시지 (예외 메시지)
 * @param step      실패가 발생한 처리 단계 (없으면 생략)
 * @param retryable 동일 요청 재시도 가능 여부
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String code,
        String message,
        String detail,
        String step,
        boolean retryable
) {
    public static ErrorResponse of(ErrorCode errorCode, String detail) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage(), detail, null, errorCode.isRetryable());
    }

    public static ErrorResponse of(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage(), e.getMessage(),
                e.getFailedStep(), errorCode.isRetryable());
    }
}
