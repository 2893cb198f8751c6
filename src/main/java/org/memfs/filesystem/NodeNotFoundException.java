package org.memfs.filesystem;

/**
 * 路径中的某一段不存在，或节点句柄已经失效。
 */
public class NodeNotFoundException extends FileSystemException {

    private final String path;

    public NodeNotFoundException(String path) {
        super("路径不存在：" + path);
        this.path = path;
    }

    private NodeNotFoundException(String path, String message) {
        super(message);
        this.path = path;
    }

    public static NodeNotFoundException forHandle(NodeId id) {
        return new NodeNotFoundException(String.valueOf(id), "节点不存在或已被删除：" + id);
    }

    /**
     * 调用方传入的原始路径（句柄失效时为句柄文本，例如 {@code #12}）。
     */
    public String getPath() {
        return path;
    }
}
