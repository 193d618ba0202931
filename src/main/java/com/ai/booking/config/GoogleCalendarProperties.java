package com.ai.booking.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "google.calendar")
public class GoogleCalendarProperties {

    @NotBlank
    private String calendarId = "primary";

    private String applicationName = "meeting-booking-agent";

    /** Authorized-user credential JSON produced by the OAuth consent flow. */
    @NotBlank
    private String credentialsFile = "config/user_token.json";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(10);
}
