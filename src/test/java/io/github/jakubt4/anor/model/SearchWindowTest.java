package io.github.jakubt4.anor.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchWindowTest {

    private static final Instant MIDNIGHT = Instant.parse("2024-06-01T00:00:00Z");

    @Test
    void cascadeWidensInConfiguredOrder() {
        final var windows = SearchWindow.cascade(MIDNIGHT,
                List.of(Duration.ofMinutes(1), Duration.ofMinutes(10), Duration.ofDays(1)));

        assertThat(windows).extracting(SearchWindow::span)
                .containsExactly(Duration.ofMinutes(2), Duration.ofMinutes(20), Duration.ofDays(2));
        assertThat(windows.get(2).start()).isEqualTo(Instant.parse("2024-05-31T00:00:00Z"));
        assertThat(windows.get(2).end()).isEqualTo(Instant.parse("2024-06-02T00:00:00Z"));
    }

    @Test
    void emptyOrInvertedWindowIsRejected() {
        assertThatThrownBy(() -> new SearchWindow(MIDNIGHT, MIDNIGHT))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SearchWindow.around(MIDNIGHT, Duration.ofMinutes(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cacheKeyEncodingIsFilesystemSafe() {
        assertThat(new CacheKey("SOHO-LASCO", 2, LocalDate.of(2001, 3, 4)).encode())
                .isEqualTo("SOHO-LASCO_2_20010304");
    }

    @Test
    void cacheKeyRefusesIdsThatWouldNeedEscaping() {
        assertThatThrownBy(() -> new CacheKey("weird/source id", 171, LocalDate.of(2024, 6, 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("weird/source id");
        assertThatThrownBy(() -> new CacheKey("SDO_AIA", 171, LocalDate.of(2024, 6, 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
