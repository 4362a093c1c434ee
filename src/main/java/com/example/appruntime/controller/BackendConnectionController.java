package com.example.appruntime.controller;

import com.example.appruntime.model.ActiveConnectionStatus;
import com.example.appruntime.model.BackendConnection;
import com.example.appruntime.model.ConnectionTestResult;
import com.example.appruntime.service.BackendConnectionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 节点连接管理接口控制器。
 */
@RestController
@RequestMapping("/api/phoenixd-connections")
@RequiredArgsConstructor
public class BackendConnectionController {

    private final BackendConnectionService connectionService;

    /**
     * 连接列表（Docker 连接在前）
     */
    @GetMapping
    public List<BackendConnection> list() {
        return connectionService.listConnections();
    }

    /**
     * 当前 active 连接及实时状态
     */
    @GetMapping("/active")
    public ActiveConnectionStatus active() {
        return connectionService.getActiveConnection();
    }

    @PostMapping
    public ResponseEntity<BackendConnection> create(@RequestBody Map<String, Object> request) {
        BackendConnection created = connectionService.createConnection(
                asString(request.get("name")),
                asString(request.get("url")),
                asString(request.get("password")));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/{id}")
    public BackendConnection update(@PathVariable Long id, @RequestBody Map<String, Object> request) {
        return connectionService.updateConnection(id,
                asString(request.get("name")),
                asString(request.get("url")),
                asString(request.get("password")));
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable Long id) {
        connectionService.deleteConnection(id);
        return Map.of("success", true, "message", "Connection deleted");
    }

    @PostMapping("/{id}/activate")
    public Map<String, Object> activate(@PathVariable Long id) {
        BackendConnection connection = connectionService.activateConnection(id);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", connection.getId());
        summary.put("name", connection.getName());
        summary.put("url", connection.getUrl());
        summary.put("docker", connection.isDocker());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("message", "Switched to " + connection.getName());
        response.put("connection", summary);
        return response;
    }

    /**
     * 测试已保存的连接
     */
    @PostMapping("/{id}/test")
    public ResponseEntity<ConnectionTestResult> testSaved(@PathVariable Long id) {
        return toResponse(connectionService.testSavedConnection(id));
    }

    /**
     * 测试未保存的地址（添加表单使用）
     */
    @PostMapping("/test")
    public ResponseEntity<ConnectionTestResult> test(@RequestBody Map<String, Object> request) {
        return toResponse(connectionService.testConnection(
                asString(request.get("url")),
                asString(request.get("password"))));
    }

    private static ResponseEntity<ConnectionTestResult> toResponse(ConnectionTestResult result) {
        return result.success() ? ResponseEntity.ok(result) : ResponseEntity.badRequest().body(result);
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
