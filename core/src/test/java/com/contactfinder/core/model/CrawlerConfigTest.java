package com.contactfinder.core.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

class CrawlerConfigTest {

    @Test
    void defaults_are_valid() {
        CrawlerConfig c = CrawlerConfig.defaults();

        assertDoesNotThrow(c::validate);
        assertEquals(CrawlerConfig.DEFAULT_DIRECTORY_URL, c.getDirectoryUrl());
        assertEquals(Duration.ofSeconds(15), c.getTimeout());
        assertEquals(Duration.ofSeconds(1), c.getDelay());
        assertEquals(8, c.getMaxContactPages());
        assertEquals(Path.of("sverigestidskrifter_contacts.csv"), c.getOutput());
        assertThat(c.getContactHints())
                .containsExactly("kontakt", "contact", "om", "about", "annonser", "editor", "redaktion");
    }

    @Test
    void hints_are_lowercased_and_deduplicated() {
        CrawlerConfig c = CrawlerConfig.defaults().setContactHints(List.of("Kontakt", " KONTAKT ", "Press", ""));

        assertThat(c.getContactHints()).containsExactly("kontakt", "press");
    }

    @Test
    void emptyHints_keep_previous_value() {
        CrawlerConfig c = CrawlerConfig.defaults().setContactHints(List.of());

        assertThat(c.getContactHints()).isEqualTo(CrawlerConfig.DEFAULT_CONTACT_HINTS);
    }

    @Test
    void invalid_values_fail_validation() {
        assertThatThrownBy(() -> CrawlerConfig.defaults().setDelay(Duration.ofMillis(-1)).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("delay");
        assertThatThrownBy(() -> CrawlerConfig.defaults().setTimeout(Duration.ZERO).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("timeout");
        assertThatThrownBy(() -> CrawlerConfig.defaults().setMaxContactPages(-1).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxContactPages");
        assertThatThrownBy(() -> CrawlerConfig.defaults().setDirectoryUrl("  ").validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CrawlerConfig.defaults().setDirectoryUrl(null).validate())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void zeroDelay_and_zeroPages_are_allowed() {
        CrawlerConfig c = CrawlerConfig.defaults().setDelay(Duration.ZERO).setMaxContactPages(0);

        assertDoesNotThrow(c::validate);
    }

    @Test
    void secondsHelpers_convert_to_durations() {
        CrawlerConfig c = CrawlerConfig.defaults().setDelaySeconds(1.5).setTimeoutMs(0);

        assertEquals(Duration.ofMillis(1500), c.getDelay());
        assertEquals(1, c.getTimeoutMs()); // 최소 1ms 로 보정
    }

    @Test
    void nonFinite_delaySeconds_are_rejected() {
        CrawlerConfig c = CrawlerConfig.defaults();

        assertThatThrownBy(() -> c.setDelaySeconds(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("delay");
        assertThatThrownBy(() -> c.setDelaySeconds(Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("delay");
        assertEquals(Duration.ofSeconds(1), c.getDelay());
    }

    @Test
    void copy_is_independent_of_later_changes() {
        CrawlerConfig orig = CrawlerConfig.defaults().setDirectoryUrl("https://a.example/");
        CrawlerConfig copy = orig.copy();

        orig.setDirectoryUrl("https://b.example/").setMaxContactPages(2).setContactHints(List.of("x"));

        assertEquals("https://a.example/", copy.getDirectoryUrl());
        assertEquals(8, copy.getMaxContactPages());
        assertThat(copy.getContactHints()).isEqualTo(CrawlerConfig.DEFAULT_CONTACT_HINTS);
    }
}
