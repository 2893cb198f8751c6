package org.memfs.filesystem.dto;

import java.util.List;

/**
 * {@code memfs_list_tree} 的返回结果。
 *
 * @param path       起始目录的绝对路径
 * @param maxDepth   本次实际使用的最大深度（已应用上限保护）
 * @param maxEntries 本次实际使用的最大条目数（已应用上限保护）
 * @param truncated  是否因超出 maxEntries 被截断
 * @param entries    目录树条目列表（先序遍历，同级按创建顺序）
 */
public record NodeTreeResult(
        String path,
        Integer maxDepth,
        Integer maxEntries,
        boolean truncated,
        List<NodeTreeEntry> entries
) {
}
