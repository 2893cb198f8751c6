package org.memfs.filesystem;

/**
 * 节点类型：目录或文件。
 */
public enum NodeKind {
    DIRECTORY,
    FILE;

    /**
     * 对外展示用的小写名称（directory / file）。
     */
    public String displayName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
