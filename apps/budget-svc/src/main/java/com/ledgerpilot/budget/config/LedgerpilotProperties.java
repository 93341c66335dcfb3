package com.ledgerpilot.budget.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "ledgerpilot")
public record LedgerpilotProperties(
        Remote remote,
        Cache cache,
        Tools tools
) {

    @ConstructorBinding
    public LedgerpilotProperties {
        if (remote == null) {
            throw new IllegalArgumentException("remote configuration must be provided");
        }
    }

    public Cache cache() {
        return cache != null ? cache : new Cache(null, null);
    }

    public Tools tools() {
        return tools != null ? tools : new Tools(null, null);
    }

    public record Remote(String baseUrl, String accessToken, Duration connectTimeout, Duration readTimeout) {
        public static final String DEFAULT_BASE_URL = "https://api.ynab.com/v1";

        public Remote {
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = DEFAULT_BASE_URL;
            }
            if (accessToken == null || accessToken.isBlank()) {
                throw new IllegalArgumentException("accessToken must be provided");
            }
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(10);
            }
            if (readTimeout == null) {
                readTimeout = Duration.ofSeconds(30);
            }
            if (connectTimeout.isNegative() || connectTimeout.isZero() || readTimeout.isNegative() || readTimeout.isZero()) {
                throw new IllegalArgumentException("timeouts must be positive");
            }
        }

        public String accessTokenTail() {
            return accessToken.length() > 4 ? accessToken.substring(accessToken.length() - 4) : "";
        }
    }

    public record Cache(Duration settingsTtl, Boolean warmOnStartup) {
        public static final Duration DEFAULT_SETTINGS_TTL = Duration.ofHours(24);

        public Cache {
            if (settingsTtl == null) {
                settingsTtl = DEFAULT_SETTINGS_TTL;
            }
            if (settingsTtl.isNegative() || settingsTtl.isZero()) {
                throw new IllegalArgumentException("settingsTtl must be positive");
            }
        }

        public boolean warmOnStartupFlag() {
            return warmOnStartup == null || warmOnStartup;
        }
    }

    public record Tools(String serverName, Boolean readOnly) {
        public Tools {
            if (serverName == null || serverName.isBlank()) {
                serverName = "ledgerpilot-budget";
            }
        }

        public boolean readOnlyFlag() {
            return readOnly != null && readOnly;
        }
    }
}
