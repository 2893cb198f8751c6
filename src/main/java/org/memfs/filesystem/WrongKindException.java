package org.memfs.filesystem;

/**
 * 节点类型不符合操作要求：例如编辑目录内容，或对文件执行仅目录可用的操作。
 */
public class WrongKindException extends FileSystemException {

    private final NodeId nodeId;
    private final NodeKind expected;

    public WrongKindException(Node node, NodeKind expected) {
        super((expected == NodeKind.DIRECTORY ? "不是目录：" : "不是文件：") + node.name());
        this.nodeId = node.id();
        this.expected = expected;
    }

    public NodeId getNodeId() {
        return nodeId;
    }

    public NodeKind getExpected() {
        return expected;
    }
}
