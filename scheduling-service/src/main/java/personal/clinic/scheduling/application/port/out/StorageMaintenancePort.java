package personal.clinic.scheduling.application.port.out;

import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.domain.model.EntityCollection;

import java.util.List;

/**
 * 저장소 유지보수 Port (백업, 파일 정보)
 */
public interface StorageMaintenancePort {

    /**
     * 컬렉션 파일 백업
     *
     * @return 생성된 백업 파일 이름
     */
    Outcome<String> backup(EntityCollection collection);

    /**
     * 백업 파일 목록 (최신순)
     *
     * @param collection 필터, null이면 전체
     */
    List<String> listBackups(EntityCollection collection);

    CollectionFileInfo fileInfo(EntityCollection collection);
}
