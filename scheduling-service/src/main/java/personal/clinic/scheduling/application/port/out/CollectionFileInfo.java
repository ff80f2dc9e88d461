package personal.clinic.scheduling.application.port.out;

import java.time.Instant;

/**
 * 컬렉션 파일 메타데이터
 *
 * @param collection   컬렉션 이름
 * @param exists       파일 존재 여부
 * @param sizeBytes    파일 크기 (없으면 0)
 * @param recordCount  레코드 수
 * @param lastModified 마지막 수정 시각 (없으면 null)
 */
public record CollectionFileInfo(
        String collection,
        boolean exists,
        long sizeBytes,
        int recordCount,
        Instant lastModified
) {
    public static CollectionFileInfo missing(String collection) {
        return new CollectionFileInfo(collection, false, 0L, 0, null);
    }
}
