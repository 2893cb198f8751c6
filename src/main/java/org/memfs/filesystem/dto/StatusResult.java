package org.memfs.filesystem.dto;

/**
 * {@code memfs_status} 的返回结果。
 *
 * @param currentPath    当前目录
 * @param homePath       home 目录（未配置或已被删除时为 null）
 * @param nodeCount      存活节点总数（含根）
 * @param historyDepth   后退栈深度
 * @param futureDepth    前进栈深度
 * @param latestSequence 最新的变更序号（0 表示尚无变更）
 */
public record StatusResult(
        String currentPath,
        String homePath,
        int nodeCount,
        int historyDepth,
        int futureDepth,
        long latestSequence
) {
}
