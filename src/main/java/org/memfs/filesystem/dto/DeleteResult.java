package org.memfs.filesystem.dto;

/**
 * {@code memfs_delete} 的返回结果。
 *
 * @param path         被删除节点原来的绝对路径
 * @param directory    是否为目录
 * @param removedCount 实际销毁的节点数（目录包含全部子孙）
 * @param currentPath  删除后的当前目录（当前目录被删除时会回到根目录）
 */
public record DeleteResult(
        String path,
        boolean directory,
        int removedCount,
        String currentPath
) {
}
