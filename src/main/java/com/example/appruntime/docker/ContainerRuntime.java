package com.example.appruntime.docker;

import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 容器运行时能力接口。编排逻辑只依赖此接口，测试中可换成内存实现。
 * <p>
 * 所有调用都有超时上限；容器不存在时抛出 {@link ContainerNotFoundException}，
 * 其他失败抛出 {@link ContainerRuntimeException}。
 */
public interface ContainerRuntime {

    /**
     * 按标签过滤列出容器（含已停止的）。
     *
     * @param labelFilter 标签过滤条件
     * @return 容器摘要
     */
    List<ContainerSummary> list(Map<String, String> labelFilter);

    /**
     * 查询容器状态。
     *
     * @param name 容器名
     * @return 容器状态
     * @throws ContainerNotFoundException 容器不存在
     */
    ContainerState inspect(String name);

    /**
     * 创建容器（不启动）。
     *
     * @param spec 容器规格
     * @return 容器 ID
     */
    String create(ContainerSpec spec);

    void start(String name);

    /**
     * 停止容器，宽限期过后强制杀死。
     *
     * @param name         容器名
     * @param graceSeconds 宽限秒数
     */
    void stop(String name, int graceSeconds);

    void remove(String name, boolean force);

    /**
     * 拉取镜像，阻塞直到完成或超时。
     *
     * @param image      镜像引用（含 tag）
     * @param onProgress 进度回调
     */
    void pull(String image, Consumer<String> onProgress);

    /**
     * 获取容器日志的原始多路复用字节流，由调用方关闭。
     *
     * @param name   容器名
     * @param tail   末尾行数
     * @param follow 是否持续跟随
     * @return 原始字节流
     */
    InputStream logs(String name, int tail, boolean follow);

    /**
     * 在容器内执行命令，返回原始多路复用输出。
     *
     * @param name 容器名
     * @param cmd  命令及参数
     * @return 原始输出字节
     */
    byte[] exec(String name, List<String> cmd);
}
