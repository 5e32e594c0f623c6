package com.spinbet.ledgersync.controller;

import com.spinbet.ledgersync.modules.chains.model.ContractEventLog;
import com.spinbet.ledgersync.service.ContractEventMonitorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Contract event listener status
 */
@Slf4j
@RestController
@RequestMapping("/api/contract-events")
@RequiredArgsConstructor
public class ContractEventStatusController {

    private final ContractEventMonitorService monitorService;

    /**
     * GET /api/contract-events/status
     *
     * @return poller snapshot and persisted checkpoint counters
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> response = new HashMap<>();
        response.put("listener", monitorService.snapshot());
        response.put("checkpoint", monitorService.checkpoint());
        response.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/contract-events/logs?status=FAILED&limit=20
     */
    @GetMapping("/logs")
    public ResponseEntity<?> getLogs(@RequestParam(required = false) String status,
                                     @RequestParam(required = false) Integer limit) {
        try {
            List<ContractEventLog> logs = monitorService.recentLogs(status, limit);
            return ResponseEntity.ok(logs);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected contract event log query: status={}", status);
            Map<String, Object> response = new HashMap<>();
            response.put("success", false);
            response.put("message", "Unknown status: " + status);
            return ResponseEntity.badRequest().body(response);
        }
    }
}
