package personal.clinic.scheduling.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.clinic.common.dto.ApiResponse;
import personal.clinic.common.health.HealthCheckService;
import personal.clinic.scheduling.adapter.in.web.dto.HealthCheckResponse;
import personal.clinic.scheduling.config.SchedulingProperties;

import java.nio.file.Path;

/**
 * Health Check API Controller
 * 데이터/백업 디렉토리 상태를 확인하는 엔드포인트
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final SchedulingProperties properties;
    private final HealthCheckService healthCheckService;

    /**
     * Health Check 엔드포인트
     * GET /api/v1/health
     */
    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        String storageStatus = healthCheckService.checkDirectory(Path.of(properties.storage().dataDir()));
        String backupStatus = healthCheckService.checkDirectory(Path.of(properties.storage().backupDir()));

        HealthCheckResponse data = new HealthCheckResponse(storageStatus, backupStatus);

        boolean allHealthy = "UP".equals(storageStatus) && "UP".equals(backupStatus);

        if (allHealthy) {
            return ResponseEntity.ok(
                    ApiResponse.success("Application is healthy", data)
            );
        } else {
            return ResponseEntity.ok(
                    ApiResponse.error("Some components are unhealthy", data)
            );
        }
    }
}
