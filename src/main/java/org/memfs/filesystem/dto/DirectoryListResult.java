package org.memfs.filesystem.dto;

import java.util.List;

/**
 * {@code memfs_list_directory} 的返回结果。
 *
 * @param path    目录的绝对路径
 * @param offset  分页偏移
 * @param limit   分页大小
 * @param total   该目录下的子节点总数
 * @param hasMore 是否还有更多数据（用于分页）
 * @param entries 条目列表（按创建顺序）
 */
public record DirectoryListResult(
        String path,
        Integer offset,
        Integer limit,
        int total,
        boolean hasMore,
        List<NodeEntry> entries
) {
}
