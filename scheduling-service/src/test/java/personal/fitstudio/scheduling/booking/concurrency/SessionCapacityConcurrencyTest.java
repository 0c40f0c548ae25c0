package personal.fitstudio.scheduling.booking.concurrency;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import personal.fitstudio.scheduling.booking.adapter.out.persistence.JpaMemberRepository;
import personal.fitstudio.scheduling.booking.adapter.out.persistence.JpaOutboxEventRepository;
import personal.fitstudio.scheduling.booking.adapter.out.persistence.JpaParticipantRepository;
import personal.fitstudio.scheduling.booking.adapter.out.persistence.JpaStudioSettingsRepository;
import personal.fitstudio.scheduling.booking.adapter.out.persistence.JpaTrainingSessionRepository;
import personal.fitstudio.scheduling.booking.adapter.out.persistence.MemberEntity;
import personal.fitstudio.scheduling.booking.application.port.in.BookingResult;
import personal.fitstudio.scheduling.booking.application.port.in.CreateBookingCommand;
import personal.fitstudio.scheduling.booking.application.port.in.CreateBookingUseCase;
import personal.fitstudio.scheduling.booking.application.port.in.GetSessionUseCase;
import personal.fitstudio.scheduling.booking.application.port.in.UpdateParticipantStatusUseCase;
import personal.fitstudio.scheduling.booking.application.port.out.NotificationEventPublisher;
import personal.fitstudio.scheduling.booking.domain.exception.ConcurrentBookingException;
import personal.fitstudio.scheduling.booking.domain.model.BookingStatus;
import personal.fitstudio.scheduling.booking.domain.model.MemberType;
import personal.fitstudio.scheduling.booking.domain.model.Participant;
import personal.fitstudio.scheduling.booking.domain.model.SessionDetails;
import personal.fitstudio.scheduling.booking.domain.model.SessionType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * 세션 단위 직렬화 검증
 * 동시 참가/취소 후에도 확정 인원 = 카운터 <= 정원, 대기 순번은 1..k 연속
 */
@Slf4j
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("세션 정원 동시성 테스트")
class SessionCapacityConcurrencyTest {

    private static final Instant START = Instant.parse("2030-01-15T09:00:00Z");
    private static final Instant END = Instant.parse("2030-01-15T10:00:00Z");
    private static final int MAX_RETRY = 5;

    @MockBean
    private NotificationEventPublisher notificationEventPublisher;

    @Autowired
    private CreateBookingUseCase createBookingUseCase;

    @Autowired
    private UpdateParticipantStatusUseCase updateParticipantStatusUseCase;

    @Autowired
    private GetSessionUseCase getSessionUseCase;

    @Autowired
    private JpaMemberRepository memberRepository;

    @Autowired
    private JpaParticipantRepository participantRepository;

    @Autowired
    private JpaTrainingSessionRepository sessionRepository;

    @Autowired
    private JpaOutboxEventRepository outboxEventRepository;

    @Autowired
    private JpaStudioSettingsRepository studioSettingsRepository;

    @AfterEach
    void tearDown() {
        outboxEventRepository.deleteAll();
        participantRepository.deleteAll();
        sessionRepository.deleteAll();
        memberRepository.deleteAll();
        studioSettingsRepository.deleteAll();
    }

    @Test
    @DisplayName("동시에 참가해도 정원을 넘겨 확정되지 않고 나머지는 순서대로 대기한다")
    void concurrentJoins_NeverExceedCapacity() throws InterruptedException {
        // given
        int capacity = 3;
        int joiners = 8;
        Long sessionId = createSession(createMember("owner"), capacity);
        List<Long> memberIds = new ArrayList<>();
        for (int i = 0; i < joiners; i++) {
            memberIds.add(createMember("joiner" + i));
        }

        // when
        AtomicInteger confirmed = new AtomicInteger();
        AtomicInteger waitlisted = new AtomicInteger();
        runConcurrently(memberIds.size(), index -> {
            BookingResult result = withRetry(() ->
                    createBookingUseCase.createBooking(joinCommand(sessionId, memberIds.get(index))));
            if (result.bookingStatus() == BookingStatus.CONFIRMED) {
                confirmed.incrementAndGet();
            } else {
                waitlisted.incrementAndGet();
            }
        });

        // then
        SessionDetails details = getSessionUseCase.getSession(sessionId);
        log.info(">>> 동시 참가 결과 - confirmed={}, waitlisted={}", confirmed.get(), waitlisted.get());

        assertThat(confirmed.get()).isEqualTo(capacity - 1);
        assertThat(waitlisted.get()).isEqualTo(joiners - (capacity - 1));
        assertCounterMatchesRoster(details, capacity);
        assertThat(waitlistPositions(details)).containsExactlyElementsOf(sequence(joiners + 1 - capacity));
    }

    @Test
    @DisplayName("확정 참가자가 동시에 취소하면 대기 1순위부터 승급되고 순번이 다시 매겨진다")
    void concurrentCancels_PromoteInOrder() throws InterruptedException {
        // given
        int capacity = 2;
        Long ownerId = createMember("owner");
        Long sessionId = createSession(ownerId, capacity);
        Long secondId = createMember("second");
        createBookingUseCase.createBooking(joinCommand(sessionId, secondId));
        List<Long> waitlistMemberIds = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            Long memberId = createMember("waiting" + i);
            createBookingUseCase.createBooking(joinCommand(sessionId, memberId));
            waitlistMemberIds.add(memberId);
        }
        List<Long> cancelling = List.of(ownerId, secondId);

        // when
        runConcurrently(cancelling.size(), index -> withRetry(() -> updateParticipantStatusUseCase
                .updateParticipantStatus(sessionId, cancelling.get(index), BookingStatus.CANCELLED)));

        // then
        SessionDetails details = getSessionUseCase.getSession(sessionId);
        assertCounterMatchesRoster(details, capacity);
        assertThat(details.participants())
                .filteredOn(p -> p.bookingStatus() == BookingStatus.CONFIRMED)
                .extracting(Participant::memberId)
                .containsExactlyInAnyOrder(waitlistMemberIds.get(0), waitlistMemberIds.get(1));
        assertThat(details.participants())
                .filteredOn(p -> p.bookingStatus() == BookingStatus.WAITLISTED)
                .extracting(Participant::memberId, Participant::waitlistPosition)
                .containsExactly(
                        tuple(waitlistMemberIds.get(2), 1),
                        tuple(waitlistMemberIds.get(3), 2));
    }

    private void runConcurrently(int tasks, IndexedTask task) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(tasks);
        CountDownLatch ready = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(tasks);
        AtomicInteger failures = new AtomicInteger();
        try {
            for (int i = 0; i < tasks; i++) {
                int index = i;
                executor.submit(() -> {
                    try {
                        ready.await();
                        task.run(index);
                    } catch (Exception e) {
                        failures.incrementAndGet();
                        log.warn(">>> 동시 요청 실패 - index={}", index, e);
                    } finally {
                        done.countDown();
                    }
                });
            }
            ready.countDown();
            assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }
        assertThat(failures.get()).isZero();
    }

    private static <T> T withRetry(Supplier<T> action) {
        ConcurrentBookingException last = null;
        for (int attempt = 0; attempt < MAX_RETRY; attempt++) {
            try {
                return action.get();
            } catch (ConcurrentBookingException e) {
                last = e;
                log.debug(">>> 재시도 - attempt={}, step={}", attempt + 1, e.getFailedStep());
            }
        }
        throw last;
    }

    private void assertCounterMatchesRoster(SessionDetails details, int capacity) {
        long confirmedCount = details.participants().stream()
                .filter(p -> p.bookingStatus() == BookingStatus.CONFIRMED)
                .count();
        assertThat(details.session().currentParticipants()).isEqualTo((int) confirmedCount);
        assertThat(confirmedCount).isLessThanOrEqualTo(capacity);
    }

    private static List<Integer> waitlistPositions(SessionDetails details) {
        return details.participants().stream()
                .filter(p -> p.bookingStatus() == BookingStatus.WAITLISTED)
                .map(Participant::waitlistPosition)
                .toList();
    }

    private static List<Integer> sequence(int size) {
        List<Integer> positions = new ArrayList<>();
        for (int i = 1; i <= size; i++) {
            positions.add(i);
        }
        return positions;
    }

    private Long createMember(String name) {
        return memberRepository.save(MemberEntity.create(name, "Tester", name + "@example.com",
                "010-0000-0000", MemberType.FULL)).getId();
    }

    private Long createSession(Long memberId, int capacity) {
        BookingResult result = createBookingUseCase.createBooking(new CreateBookingCommand(
                null, SessionType.MEMBER, 3L, 7L, START, END, capacity, null, memberId, null, null));
        return result.sessionId();
    }

    private static CreateBookingCommand joinCommand(Long sessionId, Long memberId) {
        return new CreateBookingCommand(sessionId, null, null, null, null, null, null, null, memberId, null, null);
    }

    @FunctionalInterface
    private interface IndexedTask {
        void run(int index);
    }
}
