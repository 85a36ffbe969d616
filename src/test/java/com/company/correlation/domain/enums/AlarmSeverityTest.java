package com.company.correlation.domain.enums;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlarmSeverityTest {

    @Test
    void parsesPerceivedSeverityLeniently() {
        assertThat(AlarmSeverity.fromString("cleared")).isEqualTo(AlarmSeverity.CLEARED);
        assertThat(AlarmSeverity.fromString(" Major ")).isEqualTo(AlarmSeverity.MAJOR);
        assertThat(AlarmSeverity.fromString("INDETERMINATE")).isEqualTo(AlarmSeverity.WARNING);
        assertThat(AlarmSeverity.fromString(null)).isEqualTo(AlarmSeverity.WARNING);
    }

    @Test
    void onlyClearedIsCleared() {
        assertThat(AlarmSeverity.CLEARED.isCleared()).isTrue();
        assertThat(AlarmSeverity.CRITICAL.isCleared()).isFalse();
    }
}
