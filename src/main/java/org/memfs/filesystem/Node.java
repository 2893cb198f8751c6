package org.memfs.filesystem;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 内存文件系统中的一个节点（目录或文件）。
 * <p>
 * 说明：
 * <ul>
 *   <li>节点只由 {@link NodeStore} 创建和修改；对外只暴露只读访问器。</li>
 *   <li>父节点与子节点都以 {@link NodeId} 句柄保存，子节点列表保持插入顺序。</li>
 *   <li>内容与大小只对文件有意义；目录的 {@link #size()} 固定为 null。</li>
 * </ul>
 */
public final class Node {

    private final NodeId id;
    private final NodeKind kind;
    private final Instant createdAt;
    private final List<NodeId> children;

    private NodeId parentId;
    private String name;
    private String content = "";
    private long size;
    private Instant modifiedAt;

    Node(NodeId id, NodeId parentId, String name, NodeKind kind, Instant createdAt) {
        this.id = id;
        this.parentId = parentId;
        this.name = name;
        this.kind = kind;
        this.createdAt = createdAt;
        this.modifiedAt = createdAt;
        this.children = (kind == NodeKind.DIRECTORY) ? new ArrayList<>() : List.of();
    }

    public NodeId id() {
        return id;
    }

    public String name() {
        return name;
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean isDirectory() {
        return kind == NodeKind.DIRECTORY;
    }

    public boolean isFile() {
        return kind == NodeKind.FILE;
    }

    public boolean isRoot() {
        return NodeStore.ROOT_ID.equals(id);
    }

    /**
     * 父节点句柄；根节点（以及已删除的节点）为 null。
     */
    public NodeId parentId() {
        return parentId;
    }

    /**
     * 子节点句柄（插入顺序，只读视图）。
     */
    public List<NodeId> childIds() {
        return Collections.unmodifiableList(children);
    }

    public String content() {
        return content;
    }

    /**
     * 内容的 UTF-8 字节数；目录返回 null。
     */
    public Long size() {
        return isFile() ? size : null;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant modifiedAt() {
        return modifiedAt;
    }

    List<NodeId> children() {
        return children;
    }

    void rename(String newName) {
        this.name = newName;
    }

    void replaceContent(String text, long sizeBytes, Instant at) {
        this.content = text;
        this.size = sizeBytes;
        this.modifiedAt = at;
    }

    // 删除时断开全部链接，之后该对象不再属于任何树
    void detach() {
        this.parentId = null;
        if (isDirectory()) {
            children.clear();
        }
    }

    @Override
    public String toString() {
        return kind.displayName() + " " + id + " '" + name + "'";
    }
}
