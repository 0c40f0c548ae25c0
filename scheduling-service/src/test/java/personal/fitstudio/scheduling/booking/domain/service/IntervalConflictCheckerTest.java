package personal.fitstudio.scheduling.booking.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import personal.fitstudio.scheduling.booking.application.config.SchedulingProperties;
import personal.fitstudio.scheduling.booking.application.port.out.TrainingSessionRepository;
import personal.fitstudio.scheduling.booking.domain.exception.BookingValidationException;
import personal.fitstudio.scheduling.booking.domain.model.AvailabilityCheck;
import personal.fitstudio.scheduling.booking.domain.model.ResourceRef;
import personal.fitstudio.scheduling.booking.domain.model.ResourceType;
import personal.fitstudio.scheduling.booking.domain.model.SessionStatus;
import personal.fitstudio.scheduling.booking.domain.model.SessionType;
import personal.fitstudio.scheduling.booking.domain.model.TrainingSession;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("IntervalConflictChecker 단위 테스트")
class IntervalConflictCheckerTest {

    private static final Long TRAINER_ID = 7L;
    private static final ResourceRef TRAINER = ResourceRef.trainer(TRAINER_ID);

    @Mock
    private TrainingSessionRepository sessionRepository;

    private IntervalConflictChecker conflictChecker;

    // 트레이너의 기존 세션 09:00-10:00
    private final TrainingSession existing = session(1L, "2025-01-15T09:00:00Z", "2025-01-15T10:00:00Z",
            SessionStatus.SCHEDULED);

    @BeforeEach
    void setUp() {
        SchedulingProperties properties = new SchedulingProperties(
                new SchedulingProperties.Studio("Europe/Berlin"),
                new SchedulingProperties.Quota(50),
                new SchedulingProperties.Lock("none", 10),
                new SchedulingProperties.Outbox(false, 500, 3, 5000),
                new SchedulingProperties.Reconciliation(false, 600_000));
        conflictChecker = new IntervalConflictChecker(sessionRepository, properties);
    }

    @Test
    @DisplayName("끝과 시작이 맞닿은 구간은 충돌이 아니다")
    void touchingInterval_Available() {
        // given: 저장소가 경계 세션을 돌려주더라도 반열린 구간으로 다시 판정
        Instant start = Instant.parse("2025-01-15T10:00:00Z");
        Instant end = Instant.parse("2025-01-15T11:00:00Z");
        given(sessionRepository.findOverlapping(TRAINER, start, end, null)).willReturn(List.of(existing));

        // when
        AvailabilityCheck result = conflictChecker.checkAvailability(TRAINER, start, end, null);

        // then
        assertThat(result.available()).isTrue();
        assertThat(result.conflicts()).isEmpty();
        assertThat(result.message()).isEqualTo("Trainer is available");
    }

    @Test
    @DisplayName("겹치는 구간은 충돌 세션과 함께 보고된다")
    void overlappingInterval_Conflict() {
        // given
        Instant start = Instant.parse("2025-01-15T09:30:00Z");
        Instant end = Instant.parse("2025-01-15T10:30:00Z");
        given(sessionRepository.findOverlapping(TRAINER, start, end, null)).willReturn(List.of(existing));

        // when
        AvailabilityCheck result = conflictChecker.checkAvailability(TRAINER, start, end, null);

        // then
        assertThat(result.available()).isFalse();
        assertThat(result.conflicts()).containsExactly(existing);
        assertThat(result.message()).isEqualTo("Trainer has 1 conflicting session(s) during this time");
    }

    @Test
    @DisplayName("같은 입력으로 두 번 검사하면 같은 결과를 돌려준다")
    void idempotent() {
        Instant start = Instant.parse("2025-01-15T09:30:00Z");
        Instant end = Instant.parse("2025-01-15T10:30:00Z");
        given(sessionRepository.findOverlapping(TRAINER, start, end, null)).willReturn(List.of(existing));

        AvailabilityCheck first = conflictChecker.checkAvailability(TRAINER, start, end, null);
        AvailabilityCheck second = conflictChecker.checkAvailability(TRAINER, start, end, null);

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("취소된 세션과 제외 대상 세션은 충돌로 보지 않는다")
    void cancelledAndExcluded_Ignored() {
        // given
        Instant start = Instant.parse("2025-01-15T09:00:00Z");
        Instant end = Instant.parse("2025-01-15T10:00:00Z");
        TrainingSession cancelled = session(2L, "2025-01-15T09:00:00Z", "2025-01-15T10:00:00Z",
                SessionStatus.CANCELLED);
        given(sessionRepository.findOverlapping(TRAINER, start, end, 1L)).willReturn(List.of(existing, cancelled));

        // when
        AvailabilityCheck result = conflictChecker.checkAvailability(TRAINER, start, end, 1L);

        // then
        assertThat(result.available()).isTrue();
    }

    @Test
    @DisplayName("충돌 세션은 시작 시각순으로 정렬된다")
    void conflicts_SortedByStart() {
        Instant start = Instant.parse("2025-01-15T08:00:00Z");
        Instant end = Instant.parse("2025-01-15T12:00:00Z");
        TrainingSession later = session(3L, "2025-01-15T11:00:00Z", "2025-01-15T11:30:00Z", SessionStatus.SCHEDULED);
        given(sessionRepository.findOverlapping(TRAINER, start, end, null)).willReturn(List.of(later, existing));

        AvailabilityCheck result = conflictChecker.checkAvailability(TRAINER, start, end, null);

        assertThat(result.conflicts()).extracting(TrainingSession::id).containsExactly(1L, 3L);
    }

    @Test
    @DisplayName("시간 구간이 잘못되면 저장소를 조회하지 않고 확인 불가로 응답한다")
    void malformedInterval_Unverified() {
        Instant at = Instant.parse("2025-01-15T09:00:00Z");

        AvailabilityCheck result = conflictChecker.checkAvailability(TRAINER, at, at.minusSeconds(60), null);

        assertThat(result.available()).isTrue();
        assertThat(result.message()).isEqualTo(AvailabilityCheck.UNVERIFIED_MESSAGE);
        verifyNoInteractions(sessionRepository);
    }

    @Test
    @DisplayName("자원 ID가 없으면 확인 불가로 응답한다")
    void missingResource_Unverified() {
        AvailabilityCheck result = conflictChecker.checkAvailability(
                new ResourceRef(ResourceType.MACHINE, null),
                Instant.parse("2025-01-15T09:00:00Z"), Instant.parse("2025-01-15T10:00:00Z"), null);

        assertThat(result).isEqualTo(AvailabilityCheck.unverified());
    }

    @Test
    @DisplayName("저장소 오류는 예외 대신 확인 불가 결과로 완화된다")
    void repositoryFailure_Unverified() {
        given(sessionRepository.findOverlapping(any(), any(), any(), any()))
                .willThrow(new QueryTimeoutException("timeout"));

        AvailabilityCheck result = conflictChecker.checkAvailability(TRAINER,
                Instant.parse("2025-01-15T09:00:00Z"), Instant.parse("2025-01-15T10:00:00Z"), null);

        assertThat(result.available()).isTrue();
        assertThat(result.message()).isEqualTo(AvailabilityCheck.UNVERIFIED_MESSAGE);
    }

    @Test
    @DisplayName("하루 일정은 스튜디오 현지 자정 기준으로 조회한다")
    void daySchedule_UsesStudioZone() {
        // given
        Instant from = Instant.parse("2025-01-14T23:00:00Z");
        Instant to = Instant.parse("2025-01-15T23:00:00Z");
        given(sessionRepository.findActiveStartingBetween(TRAINER, from, to)).willReturn(List.of(existing));

        // when
        List<TrainingSession> schedule = conflictChecker.getDaySchedule(TRAINER, LocalDate.of(2025, 1, 15));

        // then
        assertThat(schedule).containsExactly(existing);
        verify(sessionRepository).findActiveStartingBetween(TRAINER, from, to);
    }

    @Test
    @DisplayName("하루 일정 조회에 날짜가 없으면 검증 오류다")
    void daySchedule_MissingDate() {
        assertThatThrownBy(() -> conflictChecker.getDaySchedule(TRAINER, null))
                .isInstanceOf(BookingValidationException.class);
    }

    private static TrainingSession session(Long id, String start, String end, SessionStatus status) {
        return new TrainingSession(id, 1L, TRAINER_ID, Instant.parse(start), Instant.parse(end), status,
                SessionType.MEMBER, 1, 0, null, Instant.parse("2025-01-01T00:00:00Z"));
    }
}
