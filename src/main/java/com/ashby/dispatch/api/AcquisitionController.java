package com.ashby.dispatch.api;

import com.ashby.core.engine.VarietyMonitor;
import com.ashby.core.model.AcquisitionSnapshot;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Acquisition state machine snapshots, one per capability the loop has seen.
 */
@RestController
@RequestMapping("/api/v1/acquisitions")
public class AcquisitionController {

    private final VarietyMonitor monitor;

    public AcquisitionController(VarietyMonitor monitor) {
        this.monitor = monitor;
    }

    @GetMapping
    public List<Map<String, Object>> listAcquisitions() {
        return monitor.listAcquisitions().stream()
                .map(AcquisitionController::toMap)
                .toList();
    }

    @GetMapping("/{capability}")
    public ResponseEntity<Map<String, Object>> getAcquisition(@PathVariable String capability) {
        return monitor.getAcquisitionStatus(capability)
                .map(s -> ResponseEntity.ok(toMap(s)))
                .orElse(ResponseEntity.notFound().build());
    }

    static Map<String, Object> toMap(AcquisitionSnapshot s) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("capability", s.capability());
        map.put("stage", s.stage().name());
        map.put("attempt", s.attempt());
        map.put("package_name", s.packageName());
        map.put("process_id", s.processId());
        map.put("tool", s.toolName());
        if (s.failure() != null) {
            Map<String, Object> failure = new LinkedHashMap<>();
            failure.put("stage", s.failure().stage().name());
            failure.put("kind", s.failure().kind().name());
            failure.put("detail", s.failure().detail());
            map.put("failure", failure);
        }
        map.put("started_at", format(s.startedAt()));
        map.put("updated_at", format(s.updatedAt()));
        map.put("next_retry_at", format(s.nextRetryAt()));
        return map;
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
