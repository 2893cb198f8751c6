package org.memfs.filesystem.dto;

import java.time.Instant;

/**
 * {@code memfs_write_file} 的返回结果。
 *
 * @param path          绝对路径
 * @param previousBytes 写入前的大小
 * @param sizeBytes     写入后的大小
 * @param modifiedAt    写入后的修改时间
 */
public record FileWriteResult(
        String path,
        long previousBytes,
        long sizeBytes,
        Instant modifiedAt
) {
}
