package personal.fitstudio.scheduling.booking.domain.model;

/**
 * 자원 참조 (트레이너 또는 머신)
 */
public record ResourceRef(ResourceType type, Long id) {

    public static ResourceRef trainer(Long trainerId) {
        return new ResourceRef(ResourceType.TRAINER, trainerId);
    }

    public static ResourceRef machine(Long machineId) {
        return new ResourceRef(ResourceType.MACHINE, machineId);
    }

    public boolean isWellFormed() {
        return type != null && id != null;
    }

    /**
     * 세션이 이 자원에 묶여 있는지 확인
     */
    public boolean isBoundTo(TrainingSession session) {
        return switch (type) {
            case TRAINER -> id.equals(session.trainerId());
            case MACHINE -> id.equals(session.machineId());
        };
    }
}
