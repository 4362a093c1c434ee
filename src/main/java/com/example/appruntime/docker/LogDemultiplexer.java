package com.example.appruntime.docker;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * 解析 Docker 多路复用日志流。
 * <p>
 * 帧格式：1 字节流类型（0=stdin, 1=stdout, 2=stderr），3 字节保留，4 字节大端负载长度，随后是负载。
 * 非多路复用的来源（例如 TTY 模式）没有帧头，按原始文本处理。
 */
public final class LogDemultiplexer {

    static final int HEADER_SIZE = 8;
    private static final int MAX_STREAM_TYPE = 2;

    private LogDemultiplexer() {
    }

    /**
     * 将帧负载按原顺序拼接为文本。
     *
     * @param buffer 原始字节
     * @return 解码后的文本
     */
    public static String demux(byte[] buffer) {
        if (buffer == null || buffer.length == 0) {
            return "";
        }

        final int length = buffer.length;
        StringBuilder result = new StringBuilder();
        int offset = 0;

        while (offset < length) {
            // 剩余不足一个帧头：原样输出
            if (length - offset < HEADER_SIZE) {
                result.append(text(buffer, offset, length));
                break;
            }

            int streamType = buffer[offset] & 0xFF;
            if (streamType > MAX_STREAM_TYPE) {
                result.append(text(buffer, offset, length));
                break;
            }

            long payloadSize = ByteBuffer.wrap(buffer, offset + 4, 4).getInt() & 0xFFFFFFFFL;
            offset += HEADER_SIZE;

            if (payloadSize > length - offset) {
                result.append(text(buffer, offset, length));
                break;
            }

            int end = offset + (int) payloadSize;
            result.append(text(buffer, offset, end));
            offset = end;
        }

        return result.toString();
    }

    private static String text(byte[] buffer, int from, int to) {
        return new String(buffer, from, to - from, StandardCharsets.UTF_8);
    }
}
