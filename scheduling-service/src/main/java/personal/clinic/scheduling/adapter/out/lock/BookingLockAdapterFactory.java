package personal.clinic.scheduling.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import personal.clinic.scheduling.application.port.out.BookingLockPort;
import personal.clinic.scheduling.config.SchedulingProperties;

/**
 * Booking Lock Adapter Factory
 * 설정에 따라 BookingLockPort 구현체를 생성
 *
 * 설정:
 * - scheduling.booking.lock-strategy=global → GlobalBookingLockAdapter (기본값)
 * - scheduling.booking.lock-strategy=provider → ProviderShardedBookingLockAdapter
 *
 * 허용되지 않는 전략 이름은 SchedulingProperties 바인딩에서 거절된다.
 */
@Slf4j
@Configuration
public class BookingLockAdapterFactory {

    @Bean
    public BookingLockPort bookingLockPort(SchedulingProperties properties) {
        BookingLockPort adapter = switch (properties.booking().lockStrategy()) {
            case SchedulingProperties.Booking.PROVIDER_LOCK -> new ProviderShardedBookingLockAdapter();
            default -> new GlobalBookingLockAdapter();
        };
        log.info("Booking lock strategy selected: strategy={}, adapter={}",
                adapter.getStrategyName(), adapter.getClass().getSimpleName());
        return adapter;
    }
}
