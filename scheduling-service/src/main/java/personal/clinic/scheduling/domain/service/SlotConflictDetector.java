package personal.clinic.scheduling.domain.service;

import org.springframework.stereotype.Component;
import personal.clinic.scheduling.domain.model.Appointment;
import personal.clinic.scheduling.domain.model.Provider;

import java.time.LocalDate;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Slot Conflict Detector (Domain Service)
 * (의사, 날짜, 시간대) 점유 여부를 판단하는 순수 도메인 로직
 * 호출자는 예약 임계 구역 안에서 호출해야 검사-후-저장이 원자적으로 보장된다.
 */
@Component
public class SlotConflictDetector {

    /**
     * 같은 시간대를 점유한 취소되지 않은 예약 검색 (선형 탐색)
     *
     * @param appointments 전체 예약 스냅샷
     * @param excludeId    검사에서 제외할 예약 ID (일정 변경 시 자기 자신), 없으면 null
     * @return 충돌 예약
     */
    public Optional<Appointment> findConflict(Collection<Appointment> appointments,
                                              String providerId,
                                              LocalDate date,
                                              String slot,
                                              String excludeId) {
        for (Appointment appointment : appointments) {
            if (excludeId != null && excludeId.equals(appointment.id())) {
                continue;
            }
            if (appointment.isLive() && appointment.occupies(providerId, date, slot)) {
                return Optional.of(appointment);
            }
        }
        return Optional.empty();
    }

    /**
     * 특정 날짜에 아직 예약되지 않은 의사의 시간대 (등록 순서 유지)
     */
    public List<String> freeSlots(Provider provider, LocalDate date, Collection<Appointment> appointments) {
        Set<String> taken = new HashSet<>();
        for (Appointment appointment : appointments) {
            if (appointment.isLive()
                    && appointment.providerId().equals(provider.id())
                    && appointment.date().equals(date)) {
                taken.add(appointment.slot());
            }
        }
        return provider.availableSlots().stream()
                .filter(slot -> !taken.contains(slot))
                .toList();
    }
}
