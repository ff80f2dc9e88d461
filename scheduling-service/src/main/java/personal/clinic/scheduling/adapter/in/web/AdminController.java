package personal.clinic.scheduling.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.clinic.common.dto.ApiResponse;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;
import personal.clinic.scheduling.application.port.in.BackupResult;
import personal.clinic.scheduling.application.port.in.GetStatisticsUseCase;
import personal.clinic.scheduling.application.port.in.ManageCacheUseCase;
import personal.clinic.scheduling.application.port.in.ManageStorageUseCase;
import personal.clinic.scheduling.application.port.in.SchedulingStatistics;
import personal.clinic.scheduling.application.port.out.CacheStats;
import personal.clinic.scheduling.application.port.out.CollectionFileInfo;
import personal.clinic.scheduling.domain.model.EntityCollection;

import java.util.List;

/**
 * Admin API Controller
 * 통계, 캐시 관리, 백업, 저장소 정보 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private final GetStatisticsUseCase getStatisticsUseCase;
    private final ManageCacheUseCase manageCacheUseCase;
    private final ManageStorageUseCase manageStorageUseCase;

    @GetMapping("/statistics")
    public ResponseEntity<ApiResponse<SchedulingStatistics>> statistics() {
        return ResponseEntity.ok(ApiResponse.success("Statistics", getStatisticsUseCase.getStatistics()));
    }

    @GetMapping("/cache")
    public ResponseEntity<ApiResponse<CacheStats>> cacheStats() {
        return ResponseEntity.ok(ApiResponse.success("Cache statistics", manageCacheUseCase.getCacheStats()));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<ApiResponse<Void>> clearCache() {
        log.info("Clear cache requested");
        manageCacheUseCase.clearCache();
        return ResponseEntity.ok(ApiResponse.success("Cache cleared"));
    }

    /**
     * 전체 컬렉션 백업
     * POST /api/v1/admin/backups
     */
    @PostMapping("/backups")
    public ResponseEntity<ApiResponse<List<BackupResult>>> backupAll() {
        log.info("Backup of all collections requested");
        List<BackupResult> results = manageStorageUseCase.backupAll();
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Backup finished", results));
    }

    /**
     * 단일 컬렉션 백업
     * POST /api/v1/admin/backups/{collection}
     */
    @PostMapping("/backups/{collection}")
    public ResponseEntity<ApiResponse<String>> backup(@PathVariable String collection) {
        log.info("Backup requested: collection={}", collection);
        return OutcomeResponses.created(
                manageStorageUseCase.backup(resolve(collection)),
                "Backup created",
                fileName -> fileName);
    }

    @GetMapping("/backups")
    public ResponseEntity<ApiResponse<List<String>>> listBackups(
            @RequestParam(required = false) String collection
    ) {
        EntityCollection filter = collection == null ? null : resolve(collection);
        return ResponseEntity.ok(ApiResponse.success("Backups found", manageStorageUseCase.listBackups(filter)));
    }

    @GetMapping("/storage")
    public ResponseEntity<ApiResponse<List<CollectionFileInfo>>> storageInfo() {
        return ResponseEntity.ok(ApiResponse.success("Storage information", manageStorageUseCase.storageInfo()));
    }

    private static EntityCollection resolve(String collection) {
        return EntityCollection.fromName(collection)
                .orElseThrow(() -> new BusinessException(ErrorCode.NOT_FOUND, "Unknown collection: " + collection));
    }
}
