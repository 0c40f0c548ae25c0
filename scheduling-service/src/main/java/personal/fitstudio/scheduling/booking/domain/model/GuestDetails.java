package personal.fitstudio.scheduling.booking.domain.model;

/**
 * 게스트 정보 (타 지점 회원 등 회원 레코드가 없는 참가자)
 */
public record GuestDetails(
        String firstName,
        String lastName,
        String gymName
) {
    public boolean isComplete() {
        return hasText(firstName) && hasText(lastName) && hasText(gymName);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
