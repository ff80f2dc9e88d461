package personal.clinic.scheduling.application.port.out;

import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.domain.model.Provider;

import java.util.List;
import java.util.Optional;

/**
 * 의사 저장소 Port
 */
public interface ProviderRepository {

    List<Provider> findAll();

    Optional<Provider> findById(String providerId);

    Outcome<Provider> save(Provider provider);

    Outcome<Provider> update(Provider provider);

    Outcome<Void> delete(String providerId);
}
