package com.autoheal.controller;

import com.autoheal.core.learning.Insights;
import com.autoheal.core.optimization.OptimizationReport;
import com.autoheal.core.repair.RepairReport;
import com.autoheal.orchestrator.AgentManager;
import com.autoheal.orchestrator.AgentStatus;
import com.autoheal.orchestrator.AuditReport;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/agents")
public class AgentController {

    private final AgentManager agentManager;

    public AgentController(AgentManager agentManager) {
        this.agentManager = agentManager;
    }

    @PostMapping("/audit")
    public ResponseEntity<AuditReport> audit() {
        return ResponseEntity.ok(agentManager.runFullAudit());
    }

    @PostMapping("/repair")
    public ResponseEntity<RepairReport> repair(
            @RequestBody(required = false) Map<String, List<String>> request
    ) {
        return ResponseEntity.ok(agentManager.runAutoRepair(types(request)));
    }

    @PostMapping("/optimize")
    public ResponseEntity<OptimizationReport> optimize(
            @RequestBody(required = false) Map<String, List<String>> request
    ) {
        return ResponseEntity.ok(agentManager.runOptimization(types(request)));
    }

    @GetMapping("/insights")
    public ResponseEntity<Insights> insights() {
        return ResponseEntity.ok(agentManager.getInsights());
    }

    @GetMapping("/status")
    public ResponseEntity<AgentStatus> status() {
        return ResponseEntity.ok(agentManager.getStatus());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    private static List<String> types(Map<String, List<String>> request) {
        return request == null ? null : request.get("types");
    }
}
