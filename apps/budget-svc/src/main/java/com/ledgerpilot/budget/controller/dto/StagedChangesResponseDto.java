package com.ledgerpilot.budget.controller.dto;

import com.ledgerpilot.budget.staging.StagedChange;
import java.util.List;

public record StagedChangesResponseDto(String sessionId, int count, List<StagedChange> changes) {
}
