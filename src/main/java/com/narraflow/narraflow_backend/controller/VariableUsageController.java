package com.narraflow.narraflow_backend.controller;

import com.narraflow.narraflow_backend.model.dto.RepairReport;
import com.narraflow.narraflow_backend.model.dto.UsageCount;
import com.narraflow.narraflow_backend.model.dto.VariableUsage;
import com.narraflow.narraflow_backend.service.VariableReferenceRepairService;
import com.narraflow.narraflow_backend.service.VariableReferenceTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/** Where a sheet variable is read or written across flows. Called by the sheet service and the UI. */
@RestController
@RequestMapping("/api/variables/{variableId}")
@RequiredArgsConstructor
public class VariableUsageController {

    private final VariableReferenceTracker referenceTracker;
    private final VariableReferenceRepairService repairService;

    @GetMapping("/usage")
    public VariableUsage usage(@PathVariable String variableId) {
        return referenceTracker.usage(variableId);
    }

    @GetMapping("/count")
    public UsageCount count(@PathVariable String variableId) {
        return referenceTracker.count(variableId);
    }

    @GetMapping("/stale")
    public VariableUsage stale(@PathVariable String variableId, @RequestParam UUID projectId) {
        return referenceTracker.checkStale(projectId, variableId);
    }

    @PostMapping("/repair")
    public RepairReport repair(@PathVariable String variableId, @RequestParam UUID projectId) {
        return repairService.repair(projectId, variableId);
    }

    /** The variable was deleted in the sheet service. */
    @DeleteMapping("/references")
    public Map<String, Integer> deleteReferences(@PathVariable String variableId) {
        return Map.of("removed", referenceTracker.deleteReferencesForVariable(variableId));
    }
}
