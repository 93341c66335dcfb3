package com.ledgerpilot.budget.controller.dto;

import java.util.List;

/**
 * {@code changeIds} null, absent or empty means every staged change.
 */
public record ApplyRequestDto(List<String> changeIds) {
}
