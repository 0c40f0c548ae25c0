package personal.fitstudio.scheduling.booking.application.port.out;

import personal.fitstudio.scheduling.booking.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Repository (Output Port)
 */
public interface OutboxEventRepository {

    OutboxEvent save(OutboxEvent outboxEvent);

    /**
     * @return 재시도 한도 미만인 PENDING 이벤트 (생성 순)
     */
    List<OutboxEvent> findPendingEvents();
}
