package com.ai.booking.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Booking flow settings, bound from {@code booking.*}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "booking")
public class BookingProperties {

    @NotBlank
    private String timezone = "Europe/Kyiv";

    @Min(5)
    @Max(480)
    private int slotDurationMinutes = 30;

    @Min(1)
    private int minProposedSlots = 3;

    @Min(1)
    private int maxProposedSlots = 5;

    @Min(0)
    private int maxWideningDays = 3;

    @Min(0)
    @Max(23)
    private int workdayStartHour = 9;

    @Min(1)
    @Max(24)
    private int workdayEndHour = 17;

    /** Commit attempts for one confirmed slot before the flow gives up. */
    @Min(1)
    private int maxBookingAttempts = 3;

    private Duration sessionTimeout = Duration.ofMinutes(30);

    @Valid
    private final Retry retry = new Retry();

    public ZoneId getZoneId() {
        return ZoneId.of(timezone);
    }

    @Getter
    @Setter
    public static class Retry {

        @Min(1)
        private int maxAttempts = 2;

        private Duration backoff = Duration.ofMillis(500);
    }
}
