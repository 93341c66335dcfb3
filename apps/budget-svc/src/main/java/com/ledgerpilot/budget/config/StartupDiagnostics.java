package com.ledgerpilot.budget.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final LedgerpilotProperties props;

    public StartupDiagnostics(LedgerpilotProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        // Never log the token itself.
        var remote = props.remote();
        log.info("Remote API config: baseUrl='{}', accessToken='***{}', connectTimeout={}, readTimeout={}",
                remote.baseUrl(), remote.accessTokenTail(), remote.connectTimeout(), remote.readTimeout());

        var cache = props.cache();
        log.info("Cache config: settingsTtl={}, warmOnStartup={}", cache.settingsTtl(), cache.warmOnStartupFlag());

        var tools = props.tools();
        log.info("Tool surface: serverName='{}', readOnly={} (env LEDGERPILOT_READ_ONLY='{}')",
                tools.serverName(), tools.readOnlyFlag(), System.getenv("LEDGERPILOT_READ_ONLY"));
    }
}
