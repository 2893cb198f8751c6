package org.memfs.filesystem.event;

import org.memfs.filesystem.Node;
import org.memfs.filesystem.NodeId;
import org.memfs.filesystem.NodeKind;

/**
 * 树结构或文件内容的变更事件。
 * <p>
 * 事件总是在一次修改完全结束、树的不变式恢复之后才发出，观察者读到的永远是一致的树。
 */
public sealed interface NodeEvent
        permits NodeEvent.Inserted, NodeEvent.Removed, NodeEvent.Renamed, NodeEvent.ContentChanged {

    /**
     * 事件涉及的节点句柄。
     */
    NodeId nodeId();

    /**
     * 新节点已挂到 {@code parentId} 的子节点末尾。
     */
    record Inserted(NodeId parentId, Node node) implements NodeEvent {
        @Override
        public NodeId nodeId() {
            return node.id();
        }
    }

    /**
     * 节点已被删除。节点本身已不存在，因此只携带删除前的快照。
     *
     * @param parentId 删除前的父节点（子树删除时可能同样已被删除）
     * @param nodeId   被删除节点的句柄（已失效）
     * @param name     删除前的名称
     * @param kind     节点类型
     * @param path     删除前的绝对路径
     */
    record Removed(NodeId parentId, NodeId nodeId, String name, NodeKind kind, String path) implements NodeEvent {
    }

    record Renamed(Node node, String oldName) implements NodeEvent {
        @Override
        public NodeId nodeId() {
            return node.id();
        }
    }

    record ContentChanged(Node node) implements NodeEvent {
        @Override
        public NodeId nodeId() {
            return node.id();
        }
    }
}
