package personal.fitstudio.scheduling.booking.domain.exception;

import personal.fitstudio.common.exception.BusinessException;
import personal.fitstudio.common.exception.ErrorCode;

/**
 * Session Not Found Exception
 */
public class SessionNotFoundException extends BusinessException {
    public SessionNotFoundException(Long sessionId) {
        super(ErrorCode.SESSION_NOT_FOUND, String.format("Session not found: sessionId=%d", sessionId));
    }
}
