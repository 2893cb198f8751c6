package org.memfs.filesystem;

/**
 * 同一目录下已存在同名节点（创建或重命名时）。
 */
public class DuplicateNameException extends FileSystemException {

    private final NodeId parentId;
    private final String name;

    public DuplicateNameException(NodeId parentId, String name) {
        super("名称已存在：" + name);
        this.parentId = parentId;
        this.name = name;
    }

    public NodeId getParentId() {
        return parentId;
    }

    public String getName() {
        return name;
    }
}
