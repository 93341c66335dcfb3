package com.ledgerpilot.budget.controller;

import com.ledgerpilot.budget.config.LedgerpilotProperties;
import com.ledgerpilot.budget.error.ReadOnlyModeException;
import org.springframework.stereotype.Component;

/**
 * Blocks operations that write to the remote ledger when the server runs read-only. Local staging
 * stays available.
 */
@Component
public class ReadOnlyGuard {

    private final boolean readOnly;

    public ReadOnlyGuard(LedgerpilotProperties properties) {
        this.readOnly = properties.tools().readOnlyFlag();
    }

    public void requireWritable(String operation) {
        if (readOnly) {
            throw new ReadOnlyModeException(operation);
        }
    }
}
