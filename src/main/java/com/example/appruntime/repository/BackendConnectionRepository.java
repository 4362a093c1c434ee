package com.example.appruntime.repository;

import com.example.appruntime.model.BackendConnection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * 节点连接仓储接口。
 */
@Repository
public interface BackendConnectionRepository extends JpaRepository<BackendConnection, Long> {

    Optional<BackendConnection> findFirstByDockerTrue();

    Optional<BackendConnection> findFirstByActiveTrue();

    Optional<BackendConnection> findFirstByUrl(String url);

    long countByActiveTrue();

    /**
     * 列表顺序：Docker 连接在前，其余按创建时间。
     */
    List<BackendConnection> findAllByOrderByDockerDescCreatedAtAsc();

    /**
     * 取消全部连接的 active 标记。只能在事务中与 {@link #markActive(Long)} 一起调用。
     *
     * @return 更新行数
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BackendConnection c SET c.active = false WHERE c.active = true")
    int deactivateAll();

    /**
     * 将指定连接标记为 active。
     *
     * @param id 连接 ID
     * @return 更新行数
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BackendConnection c SET c.active = true WHERE c.id = :id")
    int markActive(Long id);
}
