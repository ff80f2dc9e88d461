package personal.clinic.scheduling.application.port.in;

import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.domain.model.Provider;

import java.util.List;

/**
 * Manage Provider UseCase (Input Port)
 * 의사 등록/조회/수정/삭제 및 진료 시간대 관리
 */
public interface ManageProviderUseCase {

    /**
     * @return Success | Rejected(DUPLICATE_LICENSE_CODE) | Failed
     */
    Outcome<Provider> register(RegisterProviderCommand command);

    Outcome<Provider> getProvider(String providerId);

    List<Provider> listProviders();

    Outcome<Provider> update(String providerId, RegisterProviderCommand command);

    Outcome<Provider> addSlot(String providerId, String slot);

    Outcome<Provider> removeSlot(String providerId, String slot);

    /**
     * 의사 삭제 (예약 존재 여부와 무관)
     */
    Outcome<Void> delete(String providerId);
}
