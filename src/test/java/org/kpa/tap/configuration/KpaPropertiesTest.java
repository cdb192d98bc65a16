package org.kpa.tap.configuration;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KpaPropertiesTest {

    @Test
    void defaults() {
        KpaProperties properties = new KpaProperties();

        assertThat(properties.getBaseUrl()).isEqualTo("https://api.kpaehs.com/v1");
        assertThat(properties.getRetry().getMaxAttempts()).isEqualTo(5);
        assertThat(properties.getRetry().getBackoffFactor()).isEqualTo(Duration.ofSeconds(2));
        assertThat(properties.getRetry().getRateLimitCooldown()).isEqualTo(Duration.ofSeconds(120));
        assertThat(properties.getRetry().getExtraRetryStatuses()).containsExactly(429);
        assertThat(properties.getSync().getParallelism()).isEqualTo(1);
        assertThat(properties.startInstant()).isEmpty();
    }

    @Test
    void parsesStartDateFormats() {
        assertThat(KpaProperties.parseTimestamp("2021-05-04")).isEqualTo(Instant.parse("2021-05-04T00:00:00Z"));
        assertThat(KpaProperties.parseTimestamp("2021-05-04T10:15:30Z")).isEqualTo(Instant.parse("2021-05-04T10:15:30Z"));
        assertThat(KpaProperties.parseTimestamp("2021-05-04T10:15:30+02:00")).isEqualTo(Instant.parse("2021-05-04T08:15:30Z"));
        assertThat(KpaProperties.parseTimestamp("2021-05-04T10:15:30")).isEqualTo(Instant.parse("2021-05-04T10:15:30Z"));
    }

    @Test
    void rejectsMalformedStartDate() {
        KpaProperties properties = new KpaProperties();
        properties.setStartDate("yesterday");

        assertThatThrownBy(properties::startInstant)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("yesterday");
    }
}
