package personal.fitstudio.scheduling.booking.domain.model;

/**
 * 중복 예약 검사 대상 자원 구분
 */
public enum ResourceType {
    TRAINER("Trainer"),
    MACHINE("Machine");

    private final String label;

    ResourceType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
