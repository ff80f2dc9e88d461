package personal.clinic.scheduling.application.service;

/**
 * 캐시 키 규칙
 * 컬렉션 이름이 모든 키의 접두어이므로 컬렉션 이름으로 무효화하면 목록/단건 키가 함께 제거된다.
 */
public final class CacheKeys {

    public static final String PATIENTS = "patients";
    public static final String PROVIDERS = "providers";
    public static final String APPOINTMENTS = "appointments";

    public static final String PATIENTS_ALL = PATIENTS + ":all";
    public static final String PROVIDERS_ALL = PROVIDERS + ":all";
    public static final String APPOINTMENTS_ALL = APPOINTMENTS + ":all";

    private CacheKeys() {
    }

    public static String patient(String patientId) {
        return PATIENTS + ":" + patientId;
    }

    public static String provider(String providerId) {
        return PROVIDERS + ":" + providerId;
    }
}
