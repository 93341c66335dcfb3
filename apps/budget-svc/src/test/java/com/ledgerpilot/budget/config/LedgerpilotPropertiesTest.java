package com.ledgerpilot.budget.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class LedgerpilotPropertiesTest {

    @Test
    void remoteDefaultsApplyWhenOmitted() {
        var remote = new LedgerpilotProperties.Remote(null, "token-abcd1234", null, null);

        assertThat(remote.baseUrl()).isEqualTo(LedgerpilotProperties.Remote.DEFAULT_BASE_URL);
        assertThat(remote.connectTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(remote.readTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(remote.accessTokenTail()).isEqualTo("1234");
    }

    @Test
    void accessTokenIsRequired() {
        assertThatThrownBy(() -> new LedgerpilotProperties.Remote(null, " ", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("accessToken");
    }

    @Test
    void cacheAndToolsFallBackToDefaults() {
        var props = new LedgerpilotProperties(new LedgerpilotProperties.Remote(null, "token", null, null), null, null);

        assertThat(props.cache().settingsTtl()).isEqualTo(Duration.ofHours(24));
        assertThat(props.cache().warmOnStartupFlag()).isTrue();
        assertThat(props.tools().readOnlyFlag()).isFalse();
        assertThat(props.tools().serverName()).isEqualTo("ledgerpilot-budget");
    }

    @Test
    void readOnlyFlagRespectsTrue() {
        var tools = new LedgerpilotProperties.Tools(null, true);

        assertThat(tools.readOnlyFlag()).isTrue();
    }

    @Test
    void settingsTtlMustBePositive() {
        assertThatThrownBy(() -> new LedgerpilotProperties.Cache(Duration.ofMinutes(-5), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("settingsTtl");
    }
}
