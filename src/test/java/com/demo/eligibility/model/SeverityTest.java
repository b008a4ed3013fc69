package com.demo.eligibility.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Severity")
class SeverityTest {

    @Test
    @DisplayName("Declaration order runs from most to least severe")
    void ordering() {
        assertThat(Severity.CRITICAL.isAtLeast(Severity.HIGH)).isTrue();
        assertThat(Severity.HIGH.isAtLeast(Severity.HIGH)).isTrue();
        assertThat(Severity.MEDIUM.isAtLeast(Severity.HIGH)).isFalse();
        assertThat(Severity.INFO.isInformational()).isTrue();
    }

    @Test
    @DisplayName("Parses codes leniently")
    void fromCode() {
        assertThat(Severity.fromCode(" high ")).isEqualTo(Severity.HIGH);
        assertThat(Severity.fromCode("warning")).isEqualTo(Severity.MEDIUM);
        assertThat(Severity.fromCode("bogus")).isEqualTo(Severity.INFO);
        assertThat(Severity.fromCode(null)).isEqualTo(Severity.INFO);
        assertThat(Severity.CRITICAL.code()).isEqualTo("critical");
    }
}
