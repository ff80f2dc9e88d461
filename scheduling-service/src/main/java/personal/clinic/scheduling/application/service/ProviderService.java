package personal.clinic.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.clinic.common.exception.ErrorCode;
import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.application.port.in.ManageProviderUseCase;
import personal.clinic.scheduling.application.port.in.RegisterProviderCommand;
import personal.clinic.scheduling.application.port.out.ProviderRepository;
import personal.clinic.scheduling.application.port.out.SnapshotCache;
import personal.clinic.scheduling.domain.model.Provider;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Provider Service
 * 의사 등록/수정/삭제 및 진료 시간대 관리
 * 면허번호 중복 검사와 저장은 쓰기 락 안에서 함께 수행한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderService implements ManageProviderUseCase {

    private final ProviderRepository providerRepository;
    private final SnapshotLookupService lookups;
    private final SnapshotCache cache;
    private final ReentrantLock writeLock = new ReentrantLock();

    @Override
    public Outcome<Provider> register(RegisterProviderCommand command) {
        writeLock.lock();
        try {
            if (licenseCodeTaken(command.licenseCode(), null)) {
                return duplicateLicenseCode(command.licenseCode());
            }
            Provider provider = Provider.register(
                    command.name(), command.licenseCode(), command.specialty(), command.availableSlots());
            Outcome<Provider> saved = providerRepository.save(provider);
            cache.invalidate(CacheKeys.PROVIDERS);

            if (saved.isSuccess()) {
                log.info("Provider registered: providerId={}, slots={}", provider.id(), provider.availableSlots());
            }
            return saved;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Outcome<Provider> getProvider(String providerId) {
        return lookups.provider(providerId)
                .map(Outcome::success)
                .orElseGet(() -> providerNotFound(providerId));
    }

    @Override
    public List<Provider> listProviders() {
        return lookups.providers();
    }

    @Override
    public Outcome<Provider> update(String providerId, RegisterProviderCommand command) {
        writeLock.lock();
        try {
            if (lookups.provider(providerId).isEmpty()) {
                return providerNotFound(providerId);
            }
            if (licenseCodeTaken(command.licenseCode(), providerId)) {
                return duplicateLicenseCode(command.licenseCode());
            }
            return modify(providerId, provider -> provider.withDetails(
                    command.name(), command.licenseCode(), command.specialty(), command.availableSlots()));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Outcome<Provider> addSlot(String providerId, String slot) {
        if (slot == null || slot.isBlank()) {
            return Outcome.rejected(ErrorCode.INVALID_INPUT, "Slot cannot be null or blank");
        }
        writeLock.lock();
        try {
            return modify(providerId, provider -> provider.withSlot(slot));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Outcome<Provider> removeSlot(String providerId, String slot) {
        writeLock.lock();
        try {
            return modify(providerId, provider -> provider.withoutSlot(slot));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Outcome<Void> delete(String providerId) {
        writeLock.lock();
        try {
            if (lookups.provider(providerId).isEmpty()) {
                return providerNotFound(providerId);
            }
            Outcome<Void> deleted = providerRepository.delete(providerId);
            cache.invalidate(CacheKeys.PROVIDERS);

            if (deleted.isSuccess()) {
                log.info("Provider deleted: providerId={}", providerId);
            }
            return deleted;
        } finally {
            writeLock.unlock();
        }
    }

    private Outcome<Provider> modify(String providerId, UnaryOperator<Provider> change) {
        Optional<Provider> existing = lookups.provider(providerId);
        if (existing.isEmpty()) {
            return providerNotFound(providerId);
        }
        Provider changed = change.apply(existing.get());
        if (changed == existing.get()) {
            return Outcome.success(changed);
        }
        Outcome<Provider> updated = providerRepository.update(changed);
        cache.invalidate(CacheKeys.PROVIDERS);

        if (updated.isSuccess()) {
            log.info("Provider updated: providerId={}, slots={}", providerId, changed.availableSlots());
        }
        return updated;
    }

    private boolean licenseCodeTaken(String licenseCode, String excludeId) {
        return lookups.providers().stream()
                .filter(provider -> !provider.id().equals(excludeId))
                .anyMatch(provider -> provider.licenseCode().equals(licenseCode));
    }

    private static <T> Outcome<T> duplicateLicenseCode(String licenseCode) {
        log.warn("Duplicate license code: licenseCode={}", licenseCode);
        return Outcome.rejected(ErrorCode.DUPLICATE_LICENSE_CODE, "License code already registered: " + licenseCode);
    }

    private static <T> Outcome<T> providerNotFound(String providerId) {
        log.warn("Provider not found: providerId={}", providerId);
        return Outcome.rejected(ErrorCode.PROVIDER_NOT_FOUND, "Provider not found: " + providerId);
    }
}
