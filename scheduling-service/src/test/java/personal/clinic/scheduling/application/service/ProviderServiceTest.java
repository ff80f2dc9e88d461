package personal.clinic.scheduling.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.clinic.common.exception.ErrorCode;
import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.application.port.in.RegisterProviderCommand;
import personal.clinic.scheduling.application.port.out.ProviderRepository;
import personal.clinic.scheduling.application.port.out.SnapshotCache;
import personal.clinic.scheduling.domain.model.Provider;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProviderService 단위 테스트")
class ProviderServiceTest {

    @Mock
    private ProviderRepository providerRepository;
    @Mock
    private SnapshotLookupService lookups;
    @Mock
    private SnapshotCache cache;

    @InjectMocks
    private ProviderService providerService;

    private final Provider choi = new Provider(
            "M1", "Dr. Choi", "CRM-1", "cardiology", List.of("09:00", "10:00"), LocalDateTime.now());

    @Test
    @DisplayName("등록 성공 - 중복 시간대는 한 번만 저장된다")
    void register_Success() {
        // given
        given(lookups.providers()).willReturn(List.of());
        given(providerRepository.save(any(Provider.class)))
                .willAnswer(invocation -> Outcome.success(invocation.getArgument(0)));

        // when
        Outcome<Provider> outcome = providerService.register(
                new RegisterProviderCommand("Dr. Park", "CRM-2", "dermatology", List.of("09:00", "09:00", "11:00")));

        // then
        assertThat(outcome.value()).map(Provider::availableSlots).contains(List.of("09:00", "11:00"));
        then(cache).should().invalidate(CacheKeys.PROVIDERS);
    }

    @Test
    @DisplayName("등록 실패 - 면허번호 중복")
    void register_DuplicateLicense() {
        // given
        given(lookups.providers()).willReturn(List.of(choi));

        // when
        Outcome<Provider> outcome = providerService.register(
                new RegisterProviderCommand("Dr. Park", "CRM-1", null, List.of()));

        // then
        assertThat(outcome.errorCode()).contains(ErrorCode.DUPLICATE_LICENSE_CODE);
        then(providerRepository).should(never()).save(any());
    }

    @Test
    @DisplayName("시간대 추가 - 새 시간대는 저장된다")
    void addSlot_New() {
        // given
        given(lookups.provider("M1")).willReturn(Optional.of(choi));
        given(providerRepository.update(any(Provider.class)))
                .willAnswer(invocation -> Outcome.success(invocation.getArgument(0)));

        // when
        Outcome<Provider> outcome = providerService.addSlot("M1", "14:00");

        // then
        assertThat(outcome.value()).map(Provider::availableSlots).contains(List.of("09:00", "10:00", "14:00"));
        then(cache).should().invalidate(CacheKeys.PROVIDERS);
    }

    @Test
    @DisplayName("시간대 추가 - 이미 있는 시간대면 저장하지 않는다")
    void addSlot_Existing() {
        // given
        given(lookups.provider("M1")).willReturn(Optional.of(choi));

        // when
        Outcome<Provider> outcome = providerService.addSlot("M1", "09:00");

        // then
        assertThat(outcome.value()).contains(choi);
        then(providerRepository).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("시간대 추가 - 빈 시간대는 거절한다")
    void addSlot_Blank() {
        Outcome<Provider> outcome = providerService.addSlot("M1", " ");

        assertThat(outcome.errorCode()).contains(ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("시간대 제거 - 존재하지 않는 의사")
    void removeSlot_ProviderNotFound() {
        given(lookups.provider("M404")).willReturn(Optional.empty());

        Outcome<Provider> outcome = providerService.removeSlot("M404", "09:00");

        assertThat(outcome.errorCode()).contains(ErrorCode.PROVIDER_NOT_FOUND);
    }

    @Test
    @DisplayName("수정 - 다른 의사의 면허번호로 바꿀 수 없다")
    void update_DuplicateLicense() {
        // given
        Provider park = new Provider("M2", "Dr. Park", "CRM-2", null, List.of(), LocalDateTime.now());
        given(lookups.provider("M2")).willReturn(Optional.of(park));
        given(lookups.providers()).willReturn(List.of(choi, park));

        // when
        Outcome<Provider> outcome = providerService.update("M2",
                new RegisterProviderCommand("Dr. Park", "CRM-1", null, null));

        // then
        assertThat(outcome.errorCode()).contains(ErrorCode.DUPLICATE_LICENSE_CODE);
    }
}
