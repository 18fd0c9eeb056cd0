package dev.reviewgate.controller;

import dev.reviewgate.dto.request.SlaRuleRequest;
import dev.reviewgate.dto.response.ReconciliationResponse;
import dev.reviewgate.dto.response.SlaRuleResponse;
import dev.reviewgate.service.ReconciliationService;
import dev.reviewgate.service.SlaRuleService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Administrator endpoints. Access is restricted to ROLE_ADMIN by the security filter chain.
 */
@RestController
@RequestMapping("/admin")
public class AdminController {

    private final ReconciliationService reconciliationService;
    private final SlaRuleService slaRuleService;

    public AdminController(ReconciliationService reconciliationService, SlaRuleService slaRuleService) {
        this.reconciliationService = reconciliationService;
        this.slaRuleService = slaRuleService;
    }

    /**
     * Runs a reconciliation sweep synchronously and returns the per-review results.
     */
    @PostMapping("/reconcile")
    public ResponseEntity<ReconciliationResponse> reconcile() {
        return ResponseEntity.ok(reconciliationService.runSweep());
    }

    @GetMapping("/sla-rules")
    public ResponseEntity<List<SlaRuleResponse>> listSlaRules() {
        return ResponseEntity.ok(slaRuleService.list());
    }

    @PutMapping("/sla-rules")
    public ResponseEntity<List<SlaRuleResponse>> replaceSlaRules(@RequestBody List<SlaRuleRequest> rules) {
        return ResponseEntity.ok(slaRuleService.replaceAll(rules));
    }
}
