package personal.clinic.scheduling.application.port.in;

/**
 * 컬렉션 백업 결과
 *
 * @param fileName 생성된 백업 파일 이름 (실패 시 null)
 * @param message  실패 사유 (성공 시 "OK")
 */
public record BackupResult(
        String collection,
        boolean success,
        String fileName,
        String message) {
}
