package personal.clinic.scheduling.domain.model;

import java.util.UUID;

/**
 * 엔티티 ID 생성기
 * 한 글자 접두사 + UUID 앞 8자리 (예: P1a2b3c4d)
 */
public final class EntityIds {

    public static final String PATIENT_PREFIX = "P";
    public static final String PROVIDER_PREFIX = "M";
    public static final String APPOINTMENT_PREFIX = "C";

    private EntityIds() {
    }

    public static String next(String prefix) {
        return prefix + UUID.randomUUID().toString().substring(0, 8);
    }
}
