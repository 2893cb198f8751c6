package org.memfs.filesystem.dto;

import java.time.Instant;

/**
 * 目录列表项（非递归）。
 *
 * @param id         节点句柄编号
 * @param name       名称（文件名/目录名）
 * @param path       绝对路径（统一使用 / 分隔）
 * @param directory  是否为目录
 * @param file       是否为文件
 * @param sizeBytes  文件大小（目录为 null）
 * @param createdAt  创建时间
 * @param modifiedAt 最后修改时间
 */
public record NodeEntry(
        long id,
        String name,
        String path,
        boolean directory,
        boolean file,
        Long sizeBytes,
        Instant createdAt,
        Instant modifiedAt
) {
}
