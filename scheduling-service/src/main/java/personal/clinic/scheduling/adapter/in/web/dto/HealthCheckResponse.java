package personal.clinic.scheduling.adapter.in.web.dto;

/**
 * 헬스 체크 응답 DTO
 *
 * @param storage 데이터 디렉토리 상태 (UP/DOWN)
 * @param backup  백업 디렉토리 상태 (UP/DOWN)
 */
public record HealthCheckResponse(
        String storage,
        String backup
) {
}
