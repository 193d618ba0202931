package com.ai.booking.config;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.calendar.Calendar;
import com.google.api.services.calendar.CalendarScopes;
import com.google.auth.http.HttpCredentialsAdapter;
import com.google.auth.oauth2.GoogleCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.List;

/**
 * Builds the authenticated Google Calendar client. Obtaining and refreshing the stored
 * token is left to the Google auth library.
 */
@Configuration
public class CalendarConfig {

    private static final Logger log = LoggerFactory.getLogger(CalendarConfig.class);

    @Bean
    public Calendar googleCalendar(GoogleCalendarProperties properties) throws IOException, GeneralSecurityException {
        Path credentialsFile = Path.of(properties.getCredentialsFile());
        if (!Files.isRegularFile(credentialsFile)) {
            throw new IllegalStateException("Calendar credentials not found: " + credentialsFile.toAbsolutePath()
                    + ". Run the OAuth consent flow and store the authorized-user token there.");
        }
        GoogleCredentials credentials;
        try (InputStream in = Files.newInputStream(credentialsFile)) {
            credentials = GoogleCredentials.fromStream(in).createScoped(List.of(CalendarScopes.CALENDAR));
        }

        HttpRequestInitializer auth = new HttpCredentialsAdapter(credentials);
        int connectTimeout = (int) properties.getConnectTimeout().toMillis();
        int readTimeout = (int) properties.getReadTimeout().toMillis();
        HttpRequestInitializer initializer = request -> {
            auth.initialize(request);
            request.setConnectTimeout(connectTimeout);
            request.setReadTimeout(readTimeout);
        };

        log.info("Google Calendar client ready: calendar={} connectTimeout={}ms readTimeout={}ms",
                properties.getCalendarId(), connectTimeout, readTimeout);
        return new Calendar.Builder(GoogleNetHttpTransport.newTrustedTransport(), GsonFactory.getDefaultInstance(), initializer)
                .setApplicationName(properties.getApplicationName())
                .build();
    }
}
