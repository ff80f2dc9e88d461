package personal.clinic.common.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Health Check 공통 유틸리티 서비스
 * 각 인프라 컴포넌트의 상태를 확인하는 재사용 가능한 메서드 제공
 */
@Slf4j
@Service
public class HealthCheckService {

    /**
     * 디렉토리 상태 확인 (존재하고 쓰기 가능해야 UP)
     *
     * @return "UP" if the directory is writable, "DOWN" otherwise
     */
    public String checkDirectory(Path directory) {
        try {
            boolean healthy = Files.isDirectory(directory) && Files.isWritable(directory);
            if (!healthy) {
                log.warn("Directory health check failed: path={}", directory);
            }
            return healthy ? "UP" : "DOWN";
        } catch (SecurityException e) {
            log.error("Directory health check failed: path={}", directory, e);
            return "DOWN";
        }
    }
}
