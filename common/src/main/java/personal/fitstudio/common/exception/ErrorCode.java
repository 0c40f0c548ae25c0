package personal.fitstudio.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code, 메시지, 재시도 가능 여부를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다.", false),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다.", false),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다.", false),

    // Member (Mxxx)
    MEMBER_NOT_FOUND(HttpStatus.NOT_FOUND, "M001", "회원을 찾을 수 없습니다.", false),

    // Scheduling Domain (Sxxx)
    BOOKING_VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "S001", "예약 요청이 유효하지 않습니다.", false),
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND, "S002", "세션을 찾을 수 없습니다.", false),
    PARTICIPANT_NOT_FOUND(HttpStatus.NOT_FOUND, "S003", "예약 참가자를 찾을 수 없습니다.", false),
    INVALID_STATUS_TRANSITION(HttpStatus.BAD_REQUEST, "S004", "허용되지 않는 상태 변경입니다.", false),
    WEEKLY_QUOTA_EXCEEDED(HttpStatus.CONFLICT, "S005", "이번 주 스튜디오 세션 한도를 초과했습니다.", false),
    CONCURRENT_BOOKING(HttpStatus.CONFLICT, "S006", "동시 예약 충돌이 발생했습니다. 다시 시도해 주세요.", true);

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;
    private final boolean retryable;

    ErrorCode(HttpStatus httpStatus, String code, String message, boolean retryable) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
        this.retryable = retryable;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
