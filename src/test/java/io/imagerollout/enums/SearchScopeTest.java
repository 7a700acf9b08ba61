package io.imagerollout.enums;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchScopeTest {

    @Test
    void testFromString_AcceptsValueAndName() {
        assertThat(SearchScope.fromString("AvailableMachines")).isEqualTo(SearchScope.AVAILABLE_MACHINES);
        assertThat(SearchScope.fromString("machineswithsessions")).isEqualTo(SearchScope.MACHINES_WITH_SESSIONS);
        assertThat(SearchScope.fromString(" BOTH ")).isEqualTo(SearchScope.BOTH);
    }

    @Test
    void testFromString_RejectsUnknown() {
        assertThatThrownBy(() -> SearchScope.fromString("Everything")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SearchScope.fromString("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testPassesIncludedByScope() {
        assertThat(SearchScope.AVAILABLE_MACHINES.includesAvailableMachines()).isTrue();
        assertThat(SearchScope.AVAILABLE_MACHINES.includesSessions()).isFalse();
        assertThat(SearchScope.MACHINES_WITH_SESSIONS.includesAvailableMachines()).isFalse();
        assertThat(SearchScope.MACHINES_WITH_SESSIONS.includesSessions()).isTrue();
        assertThat(SearchScope.BOTH.includesAvailableMachines()).isTrue();
        assertThat(SearchScope.BOTH.includesSessions()).isTrue();
    }
}
