package com.flagship.restaurant_ledger.recurrence.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class GenerationReport {
    int generatedCount;
    int skippedCount;
    List<RuleFailure> errors;

    @Value
    public static class RuleFailure {
        Long ruleId;
        String ruleName;
        String message;
    }
}
