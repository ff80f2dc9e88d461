package personal.clinic.scheduling.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Locale;

/**
 * Scheduling 설정 Properties
 * application.yml의 scheduling.* 설정을 바인딩
 * 잘못된 값은 바인딩 시점에 거절되어 기동이 실패한다.
 */
@ConfigurationProperties(prefix = "scheduling")
public record SchedulingProperties(
        @DefaultValue Storage storage,
        @DefaultValue Cache cache,
        @DefaultValue Booking booking
) {
    public record Storage(
            @DefaultValue("./data/appointments") String dataDir,
            @DefaultValue("./data/backups") String backupDir
    ) {}

    public record Cache(
            @DefaultValue("100") int maxSize,
            @DefaultValue("300") int ttlSeconds,
            @DefaultValue("60000") long cleanupIntervalMs
    ) {
        public Cache {
            if (cleanupIntervalMs <= 0) {
                throw new IllegalArgumentException(
                        "scheduling.cache.cleanup-interval-ms must be positive: " + cleanupIntervalMs);
            }
        }
    }

    public record Booking(
            @DefaultValue("global") String lockStrategy
    ) {
        public static final String GLOBAL_LOCK = "global";
        public static final String PROVIDER_LOCK = "provider";
        public static final List<String> LOCK_STRATEGIES = List.of(GLOBAL_LOCK, PROVIDER_LOCK);

        public Booking {
            String normalized = lockStrategy == null ? "" : lockStrategy.trim().toLowerCase(Locale.ROOT);
            if (!LOCK_STRATEGIES.contains(normalized)) {
                throw new IllegalArgumentException("Unknown scheduling.booking.lock-strategy '" + lockStrategy
                        + "', expected one of " + LOCK_STRATEGIES);
            }
            lockStrategy = normalized;
        }
    }
}
