package personal.fitstudio.scheduling.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.fitstudio.scheduling.booking.application.config.SchedulingProperties;
import personal.fitstudio.scheduling.booking.application.port.out.OutboxEventRepository;
import personal.fitstudio.scheduling.booking.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Persistence Adapter
 * OutboxEventRepository 구현체
 */
@Component
@RequiredArgsConstructor
public class OutboxEventPersistenceAdapter implements OutboxEventRepository {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;
    private final SchedulingProperties properties;

    @Override
    public OutboxEvent save(OutboxEvent outboxEvent) {
        OutboxEventEntity saved = jpaOutboxEventRepository.save(OutboxEventEntity.fromDomain(outboxEvent));
        return saved.toDomain();
    }

    @Override
    public List<OutboxEvent> findPendingEvents() {
        return jpaOutboxEventRepository.findByStatusAndRetryCountLessThanOrderByCreatedAtAsc(
                        OutboxEvent.OutboxEventStatus.PENDING,
                        properties.outbox().maxRetryCount())
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }
}
