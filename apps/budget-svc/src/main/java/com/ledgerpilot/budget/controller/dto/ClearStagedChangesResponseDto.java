package com.ledgerpilot.budget.controller.dto;

public record ClearStagedChangesResponseDto(int clearedCount, int remainingCount) {
}
