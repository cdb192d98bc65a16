package org.kpa.tap.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "kpa")
public class KpaProperties {

    public static final String DEFAULT_BASE_URL = "https://api.kpaehs.com/v1";

    @NotBlank
    private String accessToken;

    private String startDate;

    private String userAgent;

    @NotBlank
    private String baseUrl = DEFAULT_BASE_URL;

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Http http = new Http();

    @Valid
    private Sync sync = new Sync();

    public Optional<Instant> startInstant() {
        if (!StringUtils.hasText(startDate)) {
            return Optional.empty();
        }
        return Optional.of(parseTimestamp(startDate.trim()));
    }

    static Instant parseTimestamp(String text) {
        try {
            if (!text.contains("T")) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException exception) {
            throw new IllegalStateException("kpa.start-date is not an ISO-8601 timestamp: " + text, exception);
        }
    }

    @Getter
    @Setter
    public static class Retry {
        @Min(1)
        private int maxAttempts = 5;
        private Duration backoffFactor = Duration.ofSeconds(2);
        private Duration rateLimitCooldown = Duration.ofSeconds(120);
        private List<Integer> extraRetryStatuses = new ArrayList<>(List.of(429));
    }

    @Getter
    @Setter
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration readTimeout = Duration.ofSeconds(300);
    }

    @Getter
    @Setter
    public static class Sync {
        @Min(1)
        private int parallelism = 1;
        @Min(1)
        private int writeBatchSize = 500;
    }
}
