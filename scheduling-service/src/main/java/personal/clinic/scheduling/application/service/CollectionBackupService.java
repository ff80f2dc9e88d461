package personal.clinic.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.application.port.in.BackupResult;
import personal.clinic.scheduling.application.port.in.ManageStorageUseCase;
import personal.clinic.scheduling.application.port.out.CollectionFileInfo;
import personal.clinic.scheduling.application.port.out.StorageMaintenancePort;
import personal.clinic.scheduling.domain.model.EntityCollection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Collection Backup Service
 * 컬렉션 파일 백업 및 저장소 정보 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollectionBackupService implements ManageStorageUseCase {

    private final StorageMaintenancePort storage;

    @Override
    public Outcome<String> backup(EntityCollection collection) {
        return storage.backup(collection);
    }

    @Override
    public List<BackupResult> backupAll() {
        List<BackupResult> results = new ArrayList<>();
        for (EntityCollection collection : EntityCollection.values()) {
            Outcome<String> outcome = storage.backup(collection);
            results.add(new BackupResult(
                    collection.collectionName(),
                    outcome.isSuccess(),
                    outcome.value().orElse(null),
                    outcome.message()));
        }
        long succeeded = results.stream().filter(BackupResult::success).count();
        log.info("Backup of all collections finished: succeeded={}, total={}", succeeded, results.size());
        return results;
    }

    @Override
    public List<String> listBackups(EntityCollection collection) {
        return storage.listBackups(collection);
    }

    @Override
    public List<CollectionFileInfo> storageInfo() {
        return Arrays.stream(EntityCollection.values())
                .map(storage::fileInfo)
                .toList();
    }
}
