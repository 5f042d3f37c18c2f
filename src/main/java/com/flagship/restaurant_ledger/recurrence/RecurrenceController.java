package com.flagship.restaurant_ledger.recurrence;

import com.flagship.restaurant_ledger.common.OperationResult;
import com.flagship.restaurant_ledger.recurrence.dto.CreateRecurrenceRuleRequest;
import com.flagship.restaurant_ledger.recurrence.dto.GenerateRequest;
import com.flagship.restaurant_ledger.recurrence.dto.GenerationReport;
import com.flagship.restaurant_ledger.recurrence.dto.UpdateRecurrenceRuleRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/recurrence-rules")
@RequiredArgsConstructor
public class RecurrenceController {

    private final RecurrenceRuleService ruleService;
    private final RecurrenceGenerator generator;

    @PostMapping
    public ResponseEntity<OperationResult<RecurrenceRule>> create(
            @Valid @RequestBody CreateRecurrenceRuleRequest request,
            @RequestHeader("X-User-Id") Long userId) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(OperationResult.ok(ruleService.createRule(request, userId), "Recurrence rule created"));
    }

    @GetMapping
    public OperationResult<List<RecurrenceRule>> list(
            @RequestParam(value = "active_only", defaultValue = "true") boolean activeOnly) {
        return OperationResult.ok(ruleService.listRules(activeOnly));
    }

    @GetMapping("/{id}")
    public OperationResult<RecurrenceRule> get(@PathVariable("id") long id) {
        return OperationResult.ok(ruleService.getRule(id));
    }

    @PatchMapping("/{id}")
    public OperationResult<RecurrenceRule> update(
            @PathVariable("id") long id,
            @RequestBody UpdateRecurrenceRuleRequest request) {
        return OperationResult.ok(ruleService.updateRule(id, request), "Recurrence rule updated");
    }

    @DeleteMapping("/{id}")
    public OperationResult<Void> deactivate(@PathVariable("id") long id) {
        ruleService.deactivateRule(id);
        return OperationResult.ok(null, "Recurrence rule deactivated");
    }

    /**
     * Generates the movements due for a period; the body may be omitted.
     */
    @PostMapping("/generate")
    public OperationResult<GenerationReport> generate(@RequestBody(required = false) GenerateRequest request) {
        GenerationReport report = request == null
                ? generator.generate()
                : generator.generate(request.getYear(), request.getMonth(), request.getWeek());
        return OperationResult.ok(report);
    }
}
