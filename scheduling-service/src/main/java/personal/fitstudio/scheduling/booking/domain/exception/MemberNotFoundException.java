package personal.fitstudio.scheduling.booking.domain.exception;

import personal.fitstudio.common.exception.BusinessException;
import personal.fitstudio.common.exception.ErrorCode;

/**
 * Member Not Found Exception
 */
public class MemberNotFoundException extends BusinessException {
    public MemberNotFoundException(Long memberId) {
        super(ErrorCode.MEMBER_NOT_FOUND, String.format("Member not found: memberId=%d", memberId));
    }
}
