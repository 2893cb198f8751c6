package org.memfs.filesystem.dto;

import java.time.Instant;

/**
 * 一条变更记录。
 *
 * @param sequence   变更序号（从 1 开始单调递增）
 * @param type       inserted / removed / renamed / content_changed
 * @param nodeId     节点句柄编号
 * @param parentId   父节点句柄编号（根为 null）
 * @param kind       directory / file
 * @param path       变更后的路径；removed 为删除前的路径
 * @param oldName    renamed 的旧名称，其余为 null
 * @param recordedAt 记录时间
 */
public record ChangeRecord(
        long sequence,
        String type,
        long nodeId,
        Long parentId,
        String kind,
        String path,
        String oldName,
        Instant recordedAt
) {
}
