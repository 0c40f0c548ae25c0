package personal.fitstudio.scheduling.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import personal.fitstudio.scheduling.booking.domain.model.OutboxEvent;

import java.util.List;

/**
 * Spring Data JPA Repository for OutboxEvent
 */
public interface JpaOutboxEventRepository extends JpaRepository<OutboxEventEntity, Long> {

    /**
     * 세션 단위 이벤트 조회
     */
    List<OutboxEventEntity> findByAggregateTypeAndAggregateIdOrderByIdAsc(String aggregateType, Long aggregateId);

    /**
     * 발행 대기 중인 이벤트 조회 (재시도 횟수 제한)
     */
    List<OutboxEventEntity> findByStatusAndRetryCountLessThanOrderByCreatedAtAsc(
            OutboxEvent.OutboxEventStatus status,
            int maxRetryCount
    );
}
