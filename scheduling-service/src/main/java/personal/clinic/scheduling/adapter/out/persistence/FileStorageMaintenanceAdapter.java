package personal.clinic.scheduling.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.application.port.out.CollectionFileInfo;
import personal.clinic.scheduling.application.port.out.StorageMaintenancePort;
import personal.clinic.scheduling.domain.model.EntityCollection;

import java.util.List;

/**
 * File Storage Maintenance Adapter
 * JsonFileStore의 백업/파일 정보 기능을 Port로 노출
 */
@Component
@RequiredArgsConstructor
public class FileStorageMaintenanceAdapter implements StorageMaintenancePort {

    private final JsonFileStore store;

    @Override
    public Outcome<String> backup(EntityCollection collection) {
        return store.backup(collection.collectionName())
                .map(path -> path.getFileName().toString());
    }

    @Override
    public List<String> listBackups(EntityCollection collection) {
        return store.listBackups(collection == null ? null : collection.collectionName());
    }

    @Override
    public CollectionFileInfo fileInfo(EntityCollection collection) {
        return store.fileInfo(collection.collectionName());
    }
}
