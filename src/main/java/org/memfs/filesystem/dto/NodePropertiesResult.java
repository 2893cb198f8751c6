package org.memfs.filesystem.dto;

import java.time.Instant;

/**
 * {@code memfs_properties} 的返回结果（对应“属性”对话框）。
 *
 * @param id             节点句柄编号
 * @param name           名称
 * @param kind           类型：directory / file
 * @param path           绝对路径
 * @param createdAt      创建时间
 * @param modifiedAt     最后修改时间
 * @param sizeBytes      文件大小（目录为 null）
 * @param sizeDisplay    可读的文件大小，例如 {@code 1.50 KB}（目录为 null）
 * @param contentPreview 内容预览（目录为 null）
 * @param childCount     直接子节点数（文件为 null）
 */
public record NodePropertiesResult(
        long id,
        String name,
        String kind,
        String path,
        Instant createdAt,
        Instant modifiedAt,
        Long sizeBytes,
        String sizeDisplay,
        String contentPreview,
        Integer childCount
) {
}
