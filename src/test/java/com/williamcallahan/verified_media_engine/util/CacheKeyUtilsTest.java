package com.williamcallahan.verified_media_engine.util;

import com.williamcallahan.verified_media_engine.model.HistoricalEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeyUtilsTest {

    private static final HistoricalEvent APOLLO = new HistoricalEvent(1969,
        "Apollo 11 moon landing: astronauts Neil Armstrong and Buzz Aldrin walk on the lunar surface");

    @Test
    @DisplayName("deriveKey keeps the first eight words of four or more letters")
    void deriveKeyUsesSignificantWords() {
        assertThat(CacheKeyUtils.deriveKey(APOLLO))
            .isEqualTo("1969_apollo_moon_landing_astronauts_neil_armstrong_buzz_aldrin");
    }

    @Test
    void deriveKeyIgnoresCaseAndPunctuation() {
        HistoricalEvent shouted = new HistoricalEvent(1969,
            "APOLLO 11 Moon-Landing!! Astronauts NEIL Armstrong & Buzz Aldrin walk on the lunar surface.");
        HistoricalEvent plain = new HistoricalEvent(1969,
            "apollo 11 moonlanding astronauts neil armstrong and buzz aldrin walk on the lunar surface");

        assertThat(CacheKeyUtils.deriveKey(shouted)).isEqualTo(CacheKeyUtils.deriveKey(plain));
    }

    @Test
    void deriveKeySeparatesYears() {
        HistoricalEvent later = new HistoricalEvent(1970, APOLLO.description());

        assertThat(CacheKeyUtils.deriveKey(later)).isNotEqualTo(CacheKeyUtils.deriveKey(APOLLO));
    }

    @Test
    void deriveKeyKeepsNonAsciiLetters() {
        HistoricalEvent event = new HistoricalEvent(1789, "Prise de la Bastille à Paris, révolution française");

        assertThat(CacheKeyUtils.deriveKey(event)).isEqualTo("1789_prise_bastille_paris_révolution_française");
    }

    @Test
    void deriveKeyHandlesNegativeYearsAndShortWords() {
        assertThat(CacheKeyUtils.deriveKey(new HistoricalEvent(-44, "Julius Caesar is assassinated")))
            .isEqualTo("-44_julius_caesar_assassinated");
        assertThat(CacheKeyUtils.deriveKey(new HistoricalEvent(1900, "a war at sea"))).isEqualTo("1900_");
    }

    @Test
    @DisplayName("searchTerm keeps the first eight words with their casing")
    void searchTermTruncatesToEightWords() {
        assertThat(CacheKeyUtils.searchTerm(APOLLO))
            .isEqualTo("Apollo 11 moon landing: astronauts Neil Armstrong and");
        assertThat(CacheKeyUtils.searchTerm(new HistoricalEvent(1900, "   "))).isEmpty();
    }

    @Test
    void descriptionPrefixCapsLength() {
        String longDescription = "x".repeat(250);

        assertThat(CacheKeyUtils.descriptionPrefix(new HistoricalEvent(1, longDescription)))
            .hasSize(CacheKeyUtils.DESCRIPTION_PREFIX_LENGTH);
        assertThat(CacheKeyUtils.descriptionPrefix(APOLLO)).isEqualTo(APOLLO.description());
    }
}
