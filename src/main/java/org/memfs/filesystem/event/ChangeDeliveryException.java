package org.memfs.filesystem.event;

/**
 * 订阅者处理变更事件失败。
 * <p>
 * 抛出时树的修改已经提交，调用方不应重试该修改；第一个失败作为 cause，其余作为 suppressed。
 */
public class ChangeDeliveryException extends RuntimeException {

    public ChangeDeliveryException(RuntimeException cause) {
        super("变更已提交，但通知订阅者失败：" + cause.getMessage(), cause);
    }
}
