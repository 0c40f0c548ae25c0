package personal.fitstudio.scheduling.booking.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.fitstudio.scheduling.booking.application.config.SchedulingProperties;
import personal.fitstudio.scheduling.booking.application.port.out.NotificationEventPublisher;
import personal.fitstudio.scheduling.booking.application.port.out.OutboxEventRepository;
import personal.fitstudio.scheduling.booking.domain.model.OutboxEvent;
import personal.fitstudio.scheduling.booking.domain.model.OutboxEvent.OutboxEventStatus;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxEventService 단위 테스트")
class OutboxEventServiceTest {

    @Mock
    private OutboxEventRepository outboxEventRepository;

    @Mock
    private NotificationEventPublisher eventPublisher;

    private OutboxEventService outboxEventService;

    @BeforeEach
    void setUp() {
        SchedulingProperties properties = new SchedulingProperties(
                new SchedulingProperties.Studio("UTC"),
                new SchedulingProperties.Quota(100),
                new SchedulingProperties.Lock("none", 10),
                new SchedulingProperties.Outbox(true, 500, 3, 5000),
                new SchedulingProperties.Reconciliation(false, 600_000));
        outboxEventService = new OutboxEventService(outboxEventRepository, eventPublisher, properties);
    }

    @Test
    @DisplayName("대기 중인 이벤트를 유형별 토픽으로 발행하고 발행 완료로 표시한다")
    void publishPendingEvents_Success() {
        // given
        OutboxEvent assigned = pending(1L, "WAITLIST_ASSIGNED", 0);
        OutboxEvent promoted = pending(2L, "WAITLIST_PROMOTED", 0);
        given(outboxEventRepository.findPendingEvents()).willReturn(List.of(assigned, promoted));

        // when
        int published = outboxEventService.publishPendingEvents();

        // then
        assertThat(published).isEqualTo(2);
        verify(eventPublisher).publishRaw(OutboxEventService.TOPIC_WAITLIST_ASSIGNED, "10", assigned.payload());
        verify(eventPublisher).publishRaw(OutboxEventService.TOPIC_WAITLIST_PROMOTED, "10", promoted.payload());

        ArgumentCaptor<OutboxEvent> captor = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxEventRepository, times(2)).save(captor.capture());
        assertThat(captor.getAllValues()).extracting(OutboxEvent::status)
                .containsOnly(OutboxEventStatus.PUBLISHED);
    }

    @Test
    @DisplayName("발행 실패 시 재시도 횟수만 증가한다")
    void publishFailure_IncrementsRetry() {
        // given
        OutboxEvent event = pending(1L, "WAITLIST_ASSIGNED", 0);
        given(outboxEventRepository.findPendingEvents()).willReturn(List.of(event));
        willThrow(new IllegalStateException("broker down"))
                .given(eventPublisher).publishRaw(OutboxEventService.TOPIC_WAITLIST_ASSIGNED, "10", event.payload());

        // when
        int published = outboxEventService.publishPendingEvents();

        // then
        assertThat(published).isZero();
        ArgumentCaptor<OutboxEvent> captor = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxEventRepository).save(captor.capture());
        assertThat(captor.getValue().retryCount()).isEqualTo(1);
        assertThat(captor.getValue().status()).isEqualTo(OutboxEventStatus.PENDING);
    }

    @Test
    @DisplayName("재시도 한도에 도달하면 실패로 표시한다")
    void publishFailure_MaxRetry_MarkedFailed() {
        // given
        OutboxEvent event = pending(1L, "WAITLIST_PROMOTED", 2);
        given(outboxEventRepository.findPendingEvents()).willReturn(List.of(event));
        willThrow(new IllegalStateException("broker down"))
                .given(eventPublisher).publishRaw(OutboxEventService.TOPIC_WAITLIST_PROMOTED, "10", event.payload());

        // when
        outboxEventService.publishPendingEvents();

        // then
        ArgumentCaptor<OutboxEvent> captor = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxEventRepository).save(captor.capture());
        assertThat(captor.getValue().retryCount()).isEqualTo(3);
        assertThat(captor.getValue().status()).isEqualTo(OutboxEventStatus.FAILED);
    }

    private static OutboxEvent pending(Long id, String type, int retryCount) {
        String payload = String.format("{\"type\":\"%s\",\"sessionId\":10,\"memberId\":100}", type);
        return new OutboxEvent(id, "TRAINING_SESSION", 10L, type, payload, OutboxEventStatus.PENDING,
                Instant.now(), null, retryCount);
    }
}
