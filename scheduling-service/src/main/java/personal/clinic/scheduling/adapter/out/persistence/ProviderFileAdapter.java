package personal.clinic.scheduling.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.application.port.out.ProviderRepository;
import personal.clinic.scheduling.domain.model.EntityCollection;
import personal.clinic.scheduling.domain.model.Provider;

import java.util.List;
import java.util.Optional;

/**
 * Provider File Adapter
 * providers.json 기반 의사 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderFileAdapter implements ProviderRepository {

    private static final String COLLECTION = EntityCollection.PROVIDERS.collectionName();

    private final JsonFileStore store;
    private final DocumentMapper mapper;

    @Override
    public List<Provider> findAll() {
        return mapper.toDomainList(store.load(COLLECTION), ProviderDocument.class, ProviderDocument::toDomain);
    }

    @Override
    public Optional<Provider> findById(String providerId) {
        log.debug("Finding provider: providerId={}", providerId);
        return store.findById(COLLECTION, providerId)
                .flatMap(record -> mapper.toDomain(record, ProviderDocument.class, ProviderDocument::toDomain));
    }

    @Override
    public Outcome<Provider> save(Provider provider) {
        log.debug("Saving provider: providerId={}, slots={}", provider.id(), provider.availableSlots().size());
        return store.append(COLLECTION, mapper.toRecord(ProviderDocument.fromDomain(provider)))
                .map(ignored -> provider);
    }

    @Override
    public Outcome<Provider> update(Provider provider) {
        log.debug("Updating provider: providerId={}", provider.id());
        return store.update(COLLECTION, provider.id(), mapper.toRecord(ProviderDocument.fromDomain(provider)))
                .map(ignored -> provider);
    }

    @Override
    public Outcome<Void> delete(String providerId) {
        return store.delete(COLLECTION, providerId);
    }
}
