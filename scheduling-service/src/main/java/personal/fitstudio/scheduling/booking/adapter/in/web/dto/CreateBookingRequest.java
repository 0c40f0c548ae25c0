package personal.fitstudio.scheduling.booking.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import personal.fitstudio.scheduling.booking.application.port.in.CreateBookingCommand;
import personal.fitstudio.scheduling.booking.domain.model.GuestDetails;
import personal.fitstudio.scheduling.booking.domain.model.NewMemberDetails;
import personal.fitstudio.scheduling.booking.domain.model.SessionType;

import java.time.Instant;

/**
 * 예약 생성 요청 DTO
 * sessionId가 있으면 기존 세션 참가 (세션 필드는 무시)
 * 세션 분류별 필수 항목 검증은 서비스에서 단계별로 수행
 */
public record CreateBookingRequest(
        Long sessionId,
        SessionType sessionType,
        Long machineId,
        Long trainerId,
        Instant scheduledStart,
        Instant scheduledEnd,
        Integer maxParticipants,

        @Size(max = 500, message = "메모는 500자 이하여야 합니다.")
        String notes,

        Long memberId,

        @Valid
        NewMemberRequest newMember,

        @Valid
        GuestRequest guest
) {
    public CreateBookingCommand toCommand() {
        return new CreateBookingCommand(
                sessionId,
                sessionType,
                machineId,
                trainerId,
                scheduledStart,
                scheduledEnd,
                maxParticipants,
                notes,
                memberId,
                newMember != null ? newMember.toDomain() : null,
                guest != null ? guest.toDomain() : null);
    }

    /**
     * 체험 세션 신규 회원 정보
     */
    public record NewMemberRequest(
            @Size(max = 100) String firstName,
            @Size(max = 100) String lastName,
            @Email(message = "이메일 형식이 올바르지 않습니다.") @Size(max = 255) String email,
            @Size(max = 30) String phone
    ) {
        NewMemberDetails toDomain() {
            return new NewMemberDetails(firstName, lastName, email, phone);
        }
    }

    /**
     * 타 지점 게스트 정보
     */
    public record GuestRequest(
            @Size(max = 100) String firstName,
            @Size(max = 100) String lastName,
            @Size(max = 100) String gymName
    ) {
        GuestDetails toDomain() {
            return new GuestDetails(firstName, lastName, gymName);
        }
    }
}
