package com.example.appruntime.controller;

import com.example.appruntime.docker.ContainerSummary;
import com.example.appruntime.model.App;
import com.example.appruntime.model.AppContainerStatus;
import com.example.appruntime.model.AppRequest;
import com.example.appruntime.model.WebhookDeliveryResult;
import com.example.appruntime.model.WebhookEventType;
import com.example.appruntime.model.WebhookLog;
import com.example.appruntime.model.WebhookStats;
import com.example.appruntime.service.AppService;
import com.example.appruntime.service.WebhookDispatchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * 应用管理接口控制器。
 */
@RestController
@RequestMapping("/api/apps")
@RequiredArgsConstructor
public class AppController {

    private final AppService appService;
    private final WebhookDispatchService webhookService;

    @GetMapping
    public List<App> list() {
        return appService.listApps();
    }

    @GetMapping("/{id}")
    public App get(@PathVariable Long id) {
        return appService.getApp(id);
    }

    /**
     * 安装应用，响应中包含完整 API Key（仅此一次）
     */
    @PostMapping
    public ResponseEntity<App> install(@RequestBody AppRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(appService.installApp(request));
    }

    @PutMapping("/{id}")
    public App update(@PathVariable Long id, @RequestBody AppRequest request) {
        return appService.updateApp(id, request);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> uninstall(@PathVariable Long id) {
        appService.uninstallApp(id);
        return Map.of("success", true, "message", "App uninstalled successfully");
    }

    @PostMapping("/{id}/start")
    public Map<String, Object> start(@PathVariable Long id) {
        boolean started = appService.startApp(id);
        return Map.of("success", true, "message", started ? "App started successfully" : "App is already running");
    }

    @PostMapping("/{id}/stop")
    public Map<String, Object> stop(@PathVariable Long id) {
        boolean stopped = appService.stopApp(id);
        return Map.of("success", true, "message", stopped ? "App stopped successfully" : "App is already stopped");
    }

    @PostMapping("/{id}/restart")
    public Map<String, Object> restart(@PathVariable Long id) {
        appService.restartApp(id);
        return Map.of("success", true, "message", "App restarted successfully");
    }

    @GetMapping("/{id}/logs")
    public Map<String, String> logs(@PathVariable Long id, @RequestParam(defaultValue = "100") int tail) {
        return Map.of("logs", appService.getLogs(id, tail));
    }

    @GetMapping("/{id}/webhooks")
    public List<WebhookLog> webhookLogs(@PathVariable Long id,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        appService.findApp(id);
        return webhookService.getWebhookLogs(id, limit, offset);
    }

    @GetMapping("/{id}/webhooks/stats")
    public WebhookStats webhookStats(@PathVariable Long id) {
        appService.findApp(id);
        return webhookService.getWebhookStats(id);
    }

    @PostMapping("/{id}/webhooks/test")
    public WebhookDeliveryResult testWebhook(@PathVariable Long id) {
        return webhookService.testWebhook(id);
    }

    @PostMapping("/{id}/regenerate-key")
    public Map<String, String> regenerateKey(@PathVariable Long id) {
        return Map.of("apiKey", appService.regenerateApiKey(id));
    }

    @PostMapping("/{id}/regenerate-secret")
    public Map<String, String> regenerateSecret(@PathVariable Long id) {
        return Map.of("webhookSecret", appService.regenerateWebhookSecret(id));
    }

    /**
     * 实时容器状态（同时刷新缓存）
     */
    @GetMapping("/{id}/status")
    public AppContainerStatus status(@PathVariable Long id) {
        return appService.refreshStatus(id);
    }

    @GetMapping("/meta/webhook-events")
    public List<String> webhookEvents() {
        return WebhookEventType.allValues();
    }

    @GetMapping("/meta/api-permissions")
    public List<String> apiPermissions() {
        return AppService.API_PERMISSIONS;
    }

    @GetMapping("/containers")
    public List<ContainerSummary> containers() {
        return appService.listContainers();
    }
}
