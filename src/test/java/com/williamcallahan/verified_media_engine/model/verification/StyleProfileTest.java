package com.williamcallahan.verified_media_engine.model.verification;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class StyleProfileTest {

    @Test
    void normalizesIndependentlyOfTheDefaultLocale() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));

            StyleProfile style = new StyleProfile(" PHOTOGRAPH ", "VINTAGE", "COLOR");

            assertThat(style.type()).isEqualTo("photograph");
            assertThat(style.era()).isEqualTo("vintage");
            assertThat(style.colorScheme()).isEqualTo("color");
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void missingDimensionsAreUnknown() {
        StyleProfile style = new StyleProfile(null, "  ", "sepia");

        assertThat(style.type()).isEqualTo(StyleProfile.UNKNOWN);
        assertThat(style.era()).isEqualTo(StyleProfile.UNKNOWN);
        assertThat(style.colorScheme()).isEqualTo("sepia");
    }
}
