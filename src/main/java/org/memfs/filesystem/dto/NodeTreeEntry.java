package org.memfs.filesystem.dto;

/**
 * 目录树条目（递归）。
 *
 * @param depth     深度（0 表示起始目录本身，1 表示其子级，依此类推）
 * @param name      名称
 * @param path      绝对路径
 * @param directory 是否为目录
 * @param file      是否为文件
 * @param sizeBytes 文件大小（目录为 null）
 */
public record NodeTreeEntry(
        int depth,
        String name,
        String path,
        boolean directory,
        boolean file,
        Long sizeBytes
) {
}
