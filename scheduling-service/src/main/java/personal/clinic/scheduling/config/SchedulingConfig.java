package personal.clinic.scheduling.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import personal.clinic.scheduling.adapter.out.cache.LruTtlCache;
import personal.clinic.scheduling.adapter.out.persistence.JsonFileStore;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Scheduling Config
 * 저장소, 캐시, 시계 빈 구성 (애플리케이션 수명 동안 싱글톤)
 * 시작 시 데이터/백업 디렉토리를 생성한다.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SchedulingProperties.class)
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public JsonFileStore jsonFileStore(SchedulingProperties properties, ObjectMapper objectMapper, Clock clock) {
        Path dataDir = createDirectory(properties.storage().dataDir());
        Path backupDir = createDirectory(properties.storage().backupDir());
        log.info("Creating JsonFileStore - dataDir={}, backupDir={}", dataDir, backupDir);
        return new JsonFileStore(dataDir, backupDir, objectMapper, clock);
    }

    @Bean(destroyMethod = "clear")
    public LruTtlCache<Object> snapshotLruCache(SchedulingProperties properties, Clock clock) {
        SchedulingProperties.Cache cache = properties.cache();
        log.info("Creating LruTtlCache - maxSize={}, ttl={}s", cache.maxSize(), cache.ttlSeconds());
        return new LruTtlCache<>(cache.maxSize(), Duration.ofSeconds(cache.ttlSeconds()), clock);
    }

    private static Path createDirectory(String location) {
        Path path = Path.of(location).toAbsolutePath().normalize();
        try {
            return Files.createDirectories(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory: " + path, e);
        }
    }
}
