package personal.clinic.scheduling.domain.model;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Provider Domain Model
 * 의사(진료 제공자) 도메인 모델 (불변)
 * 진료 가능 시간대(availableSlots)는 등록 순서를 유지하는 중복 없는 목록이다.
 */
public record Provider(
        String id,
        String name,
        String licenseCode,
        String specialty,
        List<String> availableSlots,
        LocalDateTime registeredAt) {

    public Provider {
        if (id == null || id.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Provider ID cannot be null or blank");
        }
        if (licenseCode == null || licenseCode.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "License code cannot be null or blank");
        }
        if (registeredAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Registration time cannot be null");
        }
        availableSlots = distinct(availableSlots);
    }

    /**
     * 신규 의사 등록 (정적 팩토리 메서드)
     */
    public static Provider register(String name, String licenseCode, String specialty, Collection<String> slots) {
        return new Provider(
                EntityIds.next(EntityIds.PROVIDER_PREFIX),
                name,
                licenseCode,
                specialty,
                slots == null ? List.of() : new ArrayList<>(slots),
                LocalDateTime.now());
    }

    public boolean offersSlot(String slot) {
        return availableSlots.contains(slot);
    }

    /**
     * 시간대 추가 (이미 있으면 자기 자신 반환)
     */
    public Provider withSlot(String slot) {
        if (offersSlot(slot)) {
            return this;
        }
        List<String> slots = new ArrayList<>(availableSlots);
        slots.add(slot);
        return new Provider(id, name, licenseCode, specialty, slots, registeredAt);
    }

    /**
     * 시간대 제거 (없으면 자기 자신 반환)
     */
    public Provider withoutSlot(String slot) {
        if (!offersSlot(slot)) {
            return this;
        }
        List<String> slots = new ArrayList<>(availableSlots);
        slots.remove(slot);
        return new Provider(id, name, licenseCode, specialty, slots, registeredAt);
    }

    /**
     * 인적 사항 및 시간대 변경 (ID, 등록 시각 유지)
     */
    public Provider withDetails(String name, String licenseCode, String specialty, Collection<String> slots) {
        return new Provider(id, name, licenseCode, specialty,
                slots == null ? availableSlots : new ArrayList<>(slots), registeredAt);
    }

    private static List<String> distinct(List<String> slots) {
        if (slots == null || slots.isEmpty()) {
            return List.of();
        }
        LinkedHashSet<String> ordered = new LinkedHashSet<>();
        for (String slot : slots) {
            if (slot != null && !slot.isBlank()) {
                ordered.add(slot);
            }
        }
        return List.copyOf(ordered);
    }
}
