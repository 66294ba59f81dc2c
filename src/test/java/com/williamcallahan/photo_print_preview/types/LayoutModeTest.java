package com.williamcallahan.photo_print_preview.types;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for parsing layout modes and orientation policies from user input
 */
class LayoutModeTest {

    @ParameterizedTest
    @ValueSource(strings = {"fill", "FILL", " Fill "})
    void parsesFill(String value) {
        assertThat(LayoutMode.parse(value)).isEqualTo(LayoutMode.FILL);
    }

    @ParameterizedTest
    @ValueSource(strings = {"fit", "FIT", "Fit"})
    void parsesFit(String value) {
        assertThat(LayoutMode.parse(value)).isEqualTo(LayoutMode.FIT);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "stretch"})
    void fromStringIsEmptyForUnknownValues(String value) {
        assertThat(LayoutMode.fromString(value)).isEmpty();
    }

    @Test
    void parseRejectsUnknownMode() {
        assertThatThrownBy(() -> LayoutMode.parse("stretch"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("stretch");
    }

    @Test
    void exposesConfigKeyAndDisplayName() {
        assertThat(LayoutMode.FILL.getConfigKey()).isEqualTo("fill");
        assertThat(LayoutMode.FIT.getDisplayName()).isEqualTo("Fit (Scale with borders)");
    }

    @ParameterizedTest
    @ValueSource(strings = {"follow-image", "FOLLOW_IMAGE", "Follow-Image"})
    void parsesFollowImagePolicy(String value) {
        assertThat(OrientationPolicy.parse(value)).isEqualTo(OrientationPolicy.FOLLOW_IMAGE);
    }

    @Test
    void blankPolicyDefaultsToPortrait() {
        assertThat(OrientationPolicy.parse(" ")).isEqualTo(OrientationPolicy.ROTATE_TO_PORTRAIT);
        assertThat(OrientationPolicy.parse(null)).isEqualTo(OrientationPolicy.ROTATE_TO_PORTRAIT);
    }

    @Test
    void unknownPolicyIsRejected() {
        assertThatThrownBy(() -> OrientationPolicy.parse("sideways"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sideways");
    }
}
