package com.example.dbjobs.controller;

import com.example.dbjobs.dto.ConnectionRequest;
import com.example.dbjobs.dto.DatabaseCapabilities;
import com.example.dbjobs.dto.HealthCheckResult;
import com.example.dbjobs.dto.HealthDashboard;
import com.example.dbjobs.dto.ProcedureInfo;
import com.example.dbjobs.dto.ProcedureParameter;
import com.example.dbjobs.dto.TableInfo;
import com.example.dbjobs.dto.TableSchema;
import com.example.dbjobs.entity.ConnectionHealthLog;
import com.example.dbjobs.entity.ConnectionProfile;
import com.example.dbjobs.enums.HealthStatus;
import com.example.dbjobs.service.CapabilityDetector;
import com.example.dbjobs.service.ConnectionManager;
import com.example.dbjobs.service.ConnectionProfileService;
import com.example.dbjobs.service.HealthMonitor;
import com.example.dbjobs.service.executor.ConnectionOpener;
import com.example.dbjobs.service.executor.ProcedureExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/connections")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Slf4j
public class ConnectionController {

    private final ConnectionProfileService profileService;
    private final ConnectionManager connectionManager;
    private final HealthMonitor healthMonitor;
    private final CapabilityDetector capabilityDetector;
    private final ConnectionOpener connectionOpener;

    // ===========================
    // 连接档案
    // ===========================

    @GetMapping
    public List<ConnectionProfile> list() {
        return profileService.list();
    }

    @GetMapping("/{id}")
    public ConnectionProfile get(@PathVariable Long id) {
        return profileService.get(id);
    }

    @PostMapping
    public ConnectionProfile create(@RequestBody ConnectionRequest request,
                                    @RequestHeader(value = "X-User-Id", required = false) Long actorId) {
        return profileService.create(request, actorId);
    }

    @PutMapping("/{id}")
    public ConnectionProfile update(@PathVariable Long id, @RequestBody ConnectionRequest request) {
        return profileService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        profileService.delete(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * 保存前试连
     */
    @PostMapping("/test")
    public HealthCheckResult test(@RequestBody ConnectionRequest request) {
        return profileService.test(request);
    }

    @PostMapping("/discover-databases")
    public List<String> discoverDatabases(@RequestBody ConnectionRequest request) {
        return profileService.discoverDatabases(request);
    }

    @GetMapping("/active")
    public Map<Long, String> activeConnections() {
        return connectionManager.getActiveConnections();
    }

    // ===========================
    // 健康与能力
    // ===========================

    @PostMapping("/{id}/health-check")
    public ResponseEntity<?> healthCheck(@PathVariable Long id) {
        HealthStatus status = healthMonitor.checkConnection(profileService.get(id), HealthMonitor.CHECKED_BY_USER);
        return ResponseEntity.ok(Map.of("status", status));
    }

    @GetMapping("/{id}/health-history")
    public List<ConnectionHealthLog> healthHistory(@PathVariable Long id,
                                                   @RequestParam(defaultValue = "24") int hours) {
        profileService.get(id);
        return healthMonitor.getHealthHistory(id, hours);
    }

    @GetMapping("/health/dashboard")
    public HealthDashboard dashboard() {
        return healthMonitor.getDashboard();
    }

    @PostMapping("/{id}/capabilities")
    public DatabaseCapabilities detectCapabilities(@PathVariable Long id) {
        return capabilityDetector.detectAndSave(profileService.get(id));
    }

    @GetMapping("/{id}/capabilities")
    public Map<String, Object> capabilities(@PathVariable Long id) {
        return capabilityDetector.getCachedCapabilities(profileService.get(id));
    }

    // ===========================
    // 结构浏览
    // ===========================

    @GetMapping("/{id}/databases")
    public List<String> databases(@PathVariable Long id) {
        return connectionManager.getConnector(profileService.get(id)).listDatabases();
    }

    @GetMapping("/{id}/schemas")
    public List<String> schemas(@PathVariable Long id) {
        return connectionManager.getConnector(profileService.get(id)).listSchemas();
    }

    @GetMapping("/{id}/tables")
    public List<TableInfo> tables(@PathVariable Long id, @RequestParam(required = false) String schema) {
        return connectionManager.getConnector(profileService.get(id)).listTables(schema);
    }

    @GetMapping("/{id}/tables/{table}")
    public TableSchema tableSchema(@PathVariable Long id, @PathVariable String table,
                                   @RequestParam(required = false) String schema) {
        return connectionManager.getConnector(profileService.get(id)).getTableSchema(table, schema);
    }

    @GetMapping("/{id}/procedures")
    public List<ProcedureInfo> procedures(@PathVariable Long id,
                                          @RequestParam(defaultValue = "public") String schema) throws SQLException {
        ConnectionProfile profile = profileService.get(id);
        return ProcedureExecutor.discoverProcedures(connectionOpener, connectionManager.resolveTarget(profile), schema);
    }

    @GetMapping("/{id}/procedures/{name}/parameters")
    public List<ProcedureParameter> procedureParameters(@PathVariable Long id, @PathVariable String name,
                                                        @RequestParam(defaultValue = "public") String schema) throws SQLException {
        ConnectionProfile profile = profileService.get(id);
        return ProcedureExecutor.getProcedureParameters(connectionOpener, connectionManager.resolveTarget(profile), name, schema);
    }
}
