package org.memfs.filesystem;

/**
 * 节点句柄：节点在 {@link NodeStore} 中的稳定编号。
 * <p>
 * 句柄在同一进程内永不复用；节点删除后，旧句柄只会“失效”，不会指向别的节点。
 * 导航历史、变更事件等只持有句柄，是否仍有效统一通过 {@link NodeStore#exists(NodeId)} 判断。
 *
 * @param value 编号（根节点为 0）
 */
public record NodeId(long value) {

    @Override
    public String toString() {
        return "#" + value;
    }
}
