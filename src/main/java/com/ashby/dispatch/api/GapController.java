package com.ashby.dispatch.api;

import com.ashby.core.engine.GapAcceptance;
import com.ashby.core.engine.VarietyMonitor;
import com.ashby.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Capability trigger interface: callers report variety gaps here.
 */
@RestController
@RequestMapping("/api/v1/gaps")
public class GapController {

    private static final Logger log = LoggerFactory.getLogger(GapController.class);

    private final VarietyMonitor monitor;

    public GapController(VarietyMonitor monitor) {
        this.monitor = monitor;
    }

    /**
     * POST /api/v1/gaps — inject a gap. Returns 202; acquisition runs in the background.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> injectGap(@RequestBody GapRequest request) {
        String source = request.source() != null && !request.source().isBlank() ? request.source() : "api";
        GapAcceptance acceptance;
        try {
            acceptance = monitor.injectGap(request.requiredCapabilities(),
                    Severity.parse(request.severity()), source);
        } catch (IllegalArgumentException e) {
            log.debug("Rejected gap: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accepted", acceptance.accepted());
        body.put("capabilities", acceptance.capabilities());
        body.put("started", acceptance.started());
        return ResponseEntity.accepted().body(body);
    }
}
