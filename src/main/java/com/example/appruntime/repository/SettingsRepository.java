package com.example.appruntime.repository;

import com.example.appruntime.model.Settings;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * 全局设置仓储接口。
 */
public interface SettingsRepository extends JpaRepository<Settings, String> {
}
