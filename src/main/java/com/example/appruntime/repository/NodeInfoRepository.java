package com.example.appruntime.repository;

import com.example.appruntime.model.NodeInfo;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * 节点信息缓存仓储接口。
 */
@Repository
public interface NodeInfoRepository extends JpaRepository<NodeInfo, String> {
}
