package personal.clinic.scheduling.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.clinic.common.exception.ErrorCode;
import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.application.port.in.BackupResult;
import personal.clinic.scheduling.application.port.out.StorageMaintenancePort;
import personal.clinic.scheduling.domain.model.EntityCollection;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
@DisplayName("CollectionBackupService 단위 테스트")
class CollectionBackupServiceTest {

    @Mock
    private StorageMaintenancePort storage;

    @InjectMocks
    private CollectionBackupService backupService;

    @Test
    @DisplayName("전체 백업은 컬렉션별 결과를 모두 반환한다 (하나가 실패해도 나머지는 진행)")
    void backupAll_ReportsEachCollection() {
        // given
        given(storage.backup(EntityCollection.PATIENTS)).willReturn(Outcome.success("patients_20251125_090000.json"));
        given(storage.backup(EntityCollection.PROVIDERS))
                .willReturn(Outcome.rejected(ErrorCode.NOT_FOUND, "Collection file does not exist: providers"));
        given(storage.backup(EntityCollection.APPOINTMENTS))
                .willReturn(Outcome.success("appointments_20251125_090000.json"));

        // when
        List<BackupResult> results = backupService.backupAll();

        // then
        assertThat(results).extracting(BackupResult::collection)
                .containsExactly("patients", "providers", "appointments");
        assertThat(results).extracting(BackupResult::success)
                .containsExactly(true, false, true);
        assertThat(results.get(1).fileName()).isNull();
        assertThat(results.get(1).message()).contains("providers");
    }
}
