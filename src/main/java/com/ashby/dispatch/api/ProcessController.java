package com.ashby.dispatch.api;

import com.ashby.core.model.ProcessInfo;
import com.ashby.supervisor.ProcessSupervisor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/processes")
public class ProcessController {

    private final ProcessSupervisor supervisor;

    public ProcessController(ProcessSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @GetMapping
    public List<Map<String, Object>> listProcesses() {
        return supervisor.listRunningProcesses().stream()
                .map(ProcessController::toMap)
                .toList();
    }

    @GetMapping("/exits")
    public List<Map<String, Object>> recentExits() {
        return supervisor.recentExits().stream()
                .map(ProcessController::toMap)
                .toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getProcess(@PathVariable String id) {
        Optional<ProcessInfo> info = supervisor.get(id);
        if (info.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        Map<String, Object> body = toMap(info.get());
        body.put("stderr_tail", supervisor.stderrTail(id));
        return ResponseEntity.ok(body);
    }

    /**
     * DELETE /api/v1/processes/{id} — stop a process. Stopping an exited process is a no-op.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> stopProcess(@PathVariable String id) {
        if (supervisor.get(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        supervisor.stop(id);
        return ResponseEntity.ok(toMap(supervisor.get(id).orElseThrow()));
    }

    private static Map<String, Object> toMap(ProcessInfo p) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", p.id());
        map.put("package_name", p.packageName());
        map.put("status", p.status().name());
        map.put("started_at", p.startedAt().toString());
        map.put("status_changed_at", p.statusChangedAt().toString());
        map.put("exit_code", p.exitCode());
        return map;
    }
}
