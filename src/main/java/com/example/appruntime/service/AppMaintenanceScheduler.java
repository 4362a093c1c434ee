package com.example.appruntime.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 周期任务：应用健康巡检与投递记录清理。
 * <p>
 * 上一轮尚未结束时本轮直接跳过。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AppMaintenanceScheduler {

    private final AppDockerService appDockerService;
    private final WebhookDispatchService webhookDispatchService;

    private final AtomicBoolean healthSweepRunning = new AtomicBoolean(false);
    private final AtomicBoolean cleanupRunning = new AtomicBoolean(false);

    /**
     * 定时任务：每 5 分钟巡检一次运行中的应用
     */
    @Scheduled(fixedDelayString = "${app.health.sweep-interval-ms:300000}",
            initialDelayString = "${app.health.sweep-initial-delay-ms:60000}")
    public void scheduledHealthSweep() {
        runHealthSweep();
    }

    /**
     * 定时任务：每天凌晨 3 点清理 30 天前的投递记录
     */
    @Scheduled(cron = "${app.webhook.cleanup-cron:0 0 3 * * ?}")
    public void scheduledCleanup() {
        runCleanup();
    }

    /**
     * 执行一轮健康巡检。
     *
     * @return false 表示上一轮仍在执行，本轮跳过
     */
    public boolean runHealthSweep() {
        if (!healthSweepRunning.compareAndSet(false, true)) {
            log.warn("[Health] Previous sweep still running, skipping");
            return false;
        }
        try {
            appDockerService.updateAllHealthStatuses();
        } catch (RuntimeException e) {
            log.error("[Health] Health sweep failed", e);
        } finally {
            healthSweepRunning.set(false);
        }
        return true;
    }

    /**
     * 执行一次投递记录清理。
     *
     * @return false 表示上一次仍在执行，本次跳过
     */
    public boolean runCleanup() {
        if (!cleanupRunning.compareAndSet(false, true)) {
            log.warn("[Cleanup] Previous cleanup still running, skipping");
            return false;
        }
        try {
            webhookDispatchService.cleanupOldWebhookLogs();
        } catch (RuntimeException e) {
            log.error("[Cleanup] Webhook log cleanup failed", e);
        } finally {
            cleanupRunning.set(false);
        }
        return true;
    }
}
