package personal.clinic.scheduling.application.port.in;

import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.application.port.out.CollectionFileInfo;
import personal.clinic.scheduling.domain.model.EntityCollection;

import java.util.List;

/**
 * Manage Storage UseCase (Input Port)
 * 컬렉션 백업, 백업 목록, 파일 정보
 */
public interface ManageStorageUseCase {

    /**
     * @return Success(백업 파일 이름) | Rejected(NOT_FOUND: 파일 없음) | Failed
     */
    Outcome<String> backup(EntityCollection collection);

    /**
     * 전체 컬렉션 백업 (컬렉션별 결과)
     */
    List<BackupResult> backupAll();

    List<String> listBackups(EntityCollection collection);

    List<CollectionFileInfo> storageInfo();
}
