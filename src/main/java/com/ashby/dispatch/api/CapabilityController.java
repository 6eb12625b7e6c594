package com.ashby.dispatch.api;

import com.ashby.core.model.CapabilityRoute;
import com.ashby.mcp.ProtocolClient;
import com.ashby.mcp.RemoteErrorException;
import com.ashby.mcp.RpcTimeoutException;
import com.ashby.router.CapabilityRouter;
import com.ashby.router.ProcessUnavailableException;
import com.ashby.router.UnknownCapabilityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routed capabilities and their invocation.
 */
@RestController
@RequestMapping("/api/v1/capabilities")
public class CapabilityController {

    private static final Logger log = LoggerFactory.getLogger(CapabilityController.class);

    private final CapabilityRouter router;
    private final ProtocolClient protocolClient;

    public CapabilityController(CapabilityRouter router, ProtocolClient protocolClient) {
        this.router = router;
        this.protocolClient = protocolClient;
    }

    @GetMapping
    public List<String> listCapabilities() {
        return router.listCapabilities();
    }

    @GetMapping("/routes")
    public List<Map<String, Object>> routes() {
        return router.routes().stream().map(CapabilityController::toMap).toList();
    }

    /**
     * POST /api/v1/capabilities/{name}/invoke — call the tool behind a capability.
     * 404 unknown capability, 503 process gone, 502 remote error, 504 timeout.
     */
    @PostMapping("/{name}/invoke")
    public ResponseEntity<Map<String, Object>> invoke(@PathVariable String name,
                                                      @RequestBody(required = false) InvokeRequest request) {
        Map<String, Object> arguments = request != null && request.arguments() != null
                ? request.arguments() : Map.of();
        Duration timeout = request != null && request.timeoutMs() != null && request.timeoutMs() > 0
                ? Duration.ofMillis(request.timeoutMs()) : protocolClient.defaultTimeout();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("capability", name);
        try {
            body.put("result", router.invoke(name, arguments, timeout));
            return ResponseEntity.ok(body);
        } catch (UnknownCapabilityException e) {
            body.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        } catch (ProcessUnavailableException e) {
            body.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        } catch (RemoteErrorException e) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("code", e.getCode());
            error.put("message", e.getRemoteMessage());
            error.put("data", e.getData());
            body.put("error", error);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
        } catch (RpcTimeoutException e) {
            log.warn("Invocation of {} timed out after {}", name, timeout);
            body.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(body);
        }
    }

    private static Map<String, Object> toMap(CapabilityRoute route) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("capability", route.capabilityName());
        map.put("process_id", route.processId());
        map.put("tool", route.toolName());
        map.put("registered_at", route.registeredAt().toString());
        return map;
    }
}
