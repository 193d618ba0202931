package com.ai.booking.config;

import com.ai.booking.calendar.CalendarGatewayException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableScheduling
@EnableConfigurationProperties({BookingProperties.class, GoogleCalendarProperties.class})
public class BookingConfig {

    private static final Logger log = LoggerFactory.getLogger(BookingConfig.class);

    @Bean
    public Clock bookingClock(BookingProperties properties) {
        return Clock.system(properties.getZoneId());
    }

    /**
     * Retry policy shared by every calendar call. Only transient failures are retried;
     * auth and rejected requests fail on the first attempt.
     */
    @Bean
    public Retry calendarRetry(BookingProperties properties) {
        return calendarRetry(properties.getRetry());
    }

    public static Retry calendarRetry(BookingProperties.Retry settings) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(settings.getBackoff(), 2.0))
                .retryOnException(e -> e instanceof CalendarGatewayException
                        && ((CalendarGatewayException) e).isTransient())
                .build();
        Retry retry = Retry.of("calendar", config);
        retry.getEventPublisher().onRetry(event -> log.warn("Calendar call retry #{} after: {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
        return retry;
    }
}
