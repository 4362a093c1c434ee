package com.example.appruntime.repository;

import com.example.appruntime.model.App;
import com.example.appruntime.model.ContainerStatus;
import com.example.appruntime.model.HealthStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 应用仓储接口。
 */
@Repository
public interface AppRepository extends JpaRepository<App, Long> {

    /**
     * 查询指定缓存状态的应用。
     *
     * @param containerStatus 容器状态
     * @return 应用列表
     */
    List<App> findByContainerStatus(ContainerStatus containerStatus);

    /**
     * 查询启用且处于指定状态的应用（Webhook 候选集）。
     *
     * @param containerStatus 容器状态
     * @return 应用列表
     */
    List<App> findByEnabledTrueAndContainerStatus(ContainerStatus containerStatus);

    Optional<App> findBySlug(String slug);

    boolean existsBySlug(String slug);

    List<App> findAllByOrderByCreatedAtDesc();

    /**
     * 只更新健康字段，避免覆盖并发修改的其他列。
     *
     * @param id           应用 ID
     * @param healthStatus 健康状态
     * @param checkedAt    检查时间
     * @return 更新行数
     */
    @Modifying
    @Transactional
    @Query("UPDATE App a SET a.healthStatus = :healthStatus, a.lastHealthCheck = :checkedAt WHERE a.id = :id")
    int updateHealth(Long id, HealthStatus healthStatus, LocalDateTime checkedAt);
}
