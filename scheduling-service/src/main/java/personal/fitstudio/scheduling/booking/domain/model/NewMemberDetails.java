package personal.fitstudio.scheduling.booking.domain.model;

/**
 * 체험 세션 예약 시 생성할 신규 회원 정보
 */
public record NewMemberDetails(
        String firstName,
        String lastName,
        String email,
        String phone
) {
    public boolean isComplete() {
        return hasText(firstName) && hasText(lastName) && hasText(email) && hasText(phone);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
