package org.memfs.filesystem.dto;

import java.util.List;

/**
 * {@code memfs_poll_changes} 的返回结果。
 *
 * @param afterSequence  本次查询的起点（不含）
 * @param latestSequence 当前最新的变更序号
 * @param hasMore        是否还有未返回的记录
 * @param gap            起点之后的部分记录已被淘汰，调用方应整体刷新而不是增量更新
 * @param records        变更记录（旧的在前）
 */
public record ChangeLogResult(
        long afterSequence,
        long latestSequence,
        boolean hasMore,
        boolean gap,
        List<ChangeRecord> records
) {
}
