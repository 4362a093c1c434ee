package com.example.appruntime.repository;

import com.example.appruntime.model.WebhookLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Webhook 投递日志仓储接口。
 */
@Repository
public interface WebhookLogRepository extends JpaRepository<WebhookLog, Long> {

    /**
     * 最近的 100 条投递记录（统计用）。
     *
     * @param appId 应用 ID
     * @return 按时间倒序的记录
     */
    List<WebhookLog> findTop100ByAppIdOrderByCreatedAtDesc(Long appId);

    /**
     * 分页查询应用的投递记录。
     *
     * @param appId    应用 ID
     * @param pageable 分页参数
     * @return 按时间倒序的记录
     */
    List<WebhookLog> findByAppIdOrderByCreatedAtDesc(Long appId, Pageable pageable);

    /**
     * 删除指定时间之前的记录
     *
     * @param cutoffDate 截止时间
     * @return 删除记录数
     */
    @Modifying
    @Query("DELETE FROM WebhookLog w WHERE w.createdAt < :cutoffDate")
    int deleteByCreatedAtBefore(LocalDateTime cutoffDate);
}
