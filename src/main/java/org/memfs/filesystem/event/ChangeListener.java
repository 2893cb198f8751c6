package org.memfs.filesystem.event;

/**
 * 变更事件观察者。回调在修改线程上同步执行。
 */
@FunctionalInterface
public interface ChangeListener {

    void onChange(NodeEvent event);
}
