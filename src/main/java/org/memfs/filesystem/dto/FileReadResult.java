package org.memfs.filesystem.dto;

import java.time.Instant;

/**
 * {@code memfs_read_file} 的返回结果。
 *
 * @param path       绝对路径
 * @param sizeBytes  内容的 UTF-8 字节数
 * @param createdAt  创建时间
 * @param modifiedAt 最后修改时间
 * @param content    文本内容
 */
public record FileReadResult(
        String path,
        long sizeBytes,
        Instant createdAt,
        Instant modifiedAt,
        String content
) {
}
