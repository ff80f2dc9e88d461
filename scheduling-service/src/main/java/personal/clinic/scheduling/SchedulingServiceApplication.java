package personal.clinic.scheduling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Scheduling Service Application
 * 환자, 의사, 진료 예약을 관리하는 단일 노드 예약 서비스
 */
@EnableScheduling  // 만료 캐시 정리
@SpringBootApplication(
    scanBasePackages = {
        "personal.clinic.scheduling",
        "personal.clinic.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class SchedulingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(SchedulingServiceApplication.class, args);
    }
}
