package personal.fitstudio.scheduling.booking.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.IntStream;

/**
 * Session Roster
 * 한 세션과 그 참가자 전체를 담는 작업 단위 (세션 락 범위 안에서만 사용)
 * 변경된 참가자/삭제된 참가자/발생한 알림을 추적하여 한 번에 저장
 */
public class SessionRoster {

    private TrainingSession session;
    // 삭제된 자리는 null로 남겨 인덱스를 유지
    private final List<Participant> slots;
    private final Set<Integer> dirtySlots = new LinkedHashSet<>();
    private final List<Participant> removed = new ArrayList<>();
    private final List<NotificationEvent> events = new ArrayList<>();
    private boolean sessionDirty;

    private SessionRoster(TrainingSession session, List<Participant> participants) {
        this.session = Objects.requireNonNull(session, "session");
        this.slots = new ArrayList<>(participants);
    }

    public static SessionRoster of(TrainingSession session, List<Participant> participants) {
        return new SessionRoster(session, participants);
    }

    public TrainingSession session() {
        return session;
    }

    public List<Participant> participants() {
        return slots.stream().filter(Objects::nonNull).toList();
    }

    public Participant participantAt(int index) {
        Participant participant = slots.get(index);
        if (participant == null) {
            throw new IllegalStateException("Participant slot was removed: index=" + index);
        }
        return participant;
    }

    public int confirmedCount() {
        return (int) slots.stream().filter(Objects::nonNull).filter(Participant::isConfirmed).count();
    }

    /**
     * 대기 순번 오름차순 목록
     */
    public List<Participant> waitlist() {
        return slots.stream()
                .filter(Objects::nonNull)
                .filter(Participant::isWaitlisted)
                .sorted(Comparator.comparing(Participant::waitlistPosition))
                .toList();
    }

    public int nextWaitlistPosition() {
        return waitlistIndexes().stream()
                .mapToInt(i -> slots.get(i).waitlistPosition())
                .max()
                .orElse(0) + 1;
    }

    /**
     * 대기 참가자 인덱스 (순번, 생성 시각, ID 순)
     */
    public List<Integer> waitlistIndexes() {
        return IntStream.range(0, slots.size())
                .filter(i -> slots.get(i) != null && slots.get(i).isWaitlisted())
                .boxed()
                .sorted(Comparator.<Integer, Integer>comparing(i -> slots.get(i).waitlistPosition())
                        .thenComparing(i -> slots.get(i).createdAt(), Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(i -> slots.get(i).id(), Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    public List<Integer> activeIndexes() {
        return IntStream.range(0, slots.size())
                .filter(i -> slots.get(i) != null && slots.get(i).isActive())
                .boxed()
                .toList();
    }

    public Optional<Integer> waitlistHeadIndex() {
        List<Integer> indexes = waitlistIndexes();
        return indexes.isEmpty() ? Optional.empty() : Optional.of(indexes.get(0));
    }

    public Optional<Integer> findIndexById(Long participantId) {
        return IntStream.range(0, slots.size())
                .filter(i -> slots.get(i) != null && participantId.equals(slots.get(i).id()))
                .boxed()
                .findFirst();
    }

    /**
     * 회원의 예약 인덱스 조회
     * 활성 예약을 우선하고, 없으면 가장 최근 예약
     */
    public Optional<Integer> findIndexByMember(Long memberId) {
        Optional<Integer> active = findActiveIndexByMember(memberId);
        if (active.isPresent()) {
            return active;
        }
        return IntStream.range(0, slots.size())
                .filter(i -> slots.get(i) != null && memberId.equals(slots.get(i).memberId()))
                .boxed()
                .reduce((first, second) -> second);
    }

    public Optional<Integer> findActiveIndexByMember(Long memberId) {
        return IntStream.range(0, slots.size())
                .filter(i -> slots.get(i) != null
                        && memberId.equals(slots.get(i).memberId())
                        && slots.get(i).isActive())
                .boxed()
                .findFirst();
    }

    // ========== 변경 추적 (WaitlistStateMachine 전용) ==========

    public int add(Participant participant) {
        slots.add(participant);
        int index = slots.size() - 1;
        dirtySlots.add(index);
        return index;
    }

    public void replace(int index, Participant participant) {
        participantAt(index);
        slots.set(index, participant);
        dirtySlots.add(index);
    }

    public Participant remove(int index) {
        Participant participant = participantAt(index);
        slots.set(index, null);
        dirtySlots.remove(index);
        if (participant.id() != null) {
            removed.add(participant);
        }
        return participant;
    }

    public void updateSession(TrainingSession updated) {
        this.session = updated;
        this.sessionDirty = true;
    }

    public void record(NotificationEvent event) {
        events.add(event);
    }

    // ========== 저장 ==========

    public boolean isSessionDirty() {
        return sessionDirty;
    }

    public List<Participant> removedParticipants() {
        return Collections.unmodifiableList(removed);
    }

    public List<NotificationEvent> pendingEvents() {
        return Collections.unmodifiableList(events);
    }

    public boolean hasChanges() {
        return sessionDirty || !dirtySlots.isEmpty() || !removed.isEmpty();
    }

    /**
     * 변경된 참가자를 저장하고 저장 결과(ID 포함)로 교체
     */
    public void flushParticipants(UnaryOperator<Participant> saver) {
        for (Integer index : dirtySlots) {
            slots.set(index, saver.apply(slots.get(index)));
        }
        dirtySlots.clear();
    }

    public void flushSession(UnaryOperator<TrainingSession> saver) {
        if (sessionDirty) {
            session = saver.apply(session);
            sessionDirty = false;
        }
    }

    public void clearRemoved() {
        removed.clear();
    }

    public List<NotificationEvent> drainEvents() {
        List<NotificationEvent> drained = List.copyOf(events);
        events.clear();
        return drained;
    }
}
