package org.memfs.filesystem.event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 变更通知总线：把 {@link NodeEvent} 同步分发给所有订阅者。
 * <p>
 * 说明：
 * <ul>
 *   <li>按订阅顺序依次回调；回调期间允许订阅/退订，本轮分发不受影响。</li>
 *   <li>某个订阅者抛出异常不会打断对其他订阅者的分发；全部分发完成后抛出 {@link ChangeDeliveryException}（第一个异常作为 cause，其余作为 suppressed）。</li>
 *   <li>总线不做任何加锁，调用方需自行保证单线程访问。</li>
 * </ul>
 */
public class ChangeNotificationBus {

    private final List<ChangeListener> listeners = new CopyOnWriteArrayList<>();

    public Subscription subscribe(ChangeListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public int subscriberCount() {
        return listeners.size();
    }

    public void publish(NodeEvent event) {
        publishAll(List.of(event));
    }

    /**
     * 按顺序分发一批事件（例如一次子树删除产生的全部 Removed 事件）。
     *
     * @throws ChangeDeliveryException 有订阅者失败；此时触发事件的修改已经提交
     */
    public void publishAll(List<? extends NodeEvent> events) {
        ChangeDeliveryException failure = null;
        for (NodeEvent event : events) {
            for (ChangeListener listener : listeners) {
                try {
                    listener.onChange(event);
                } catch (RuntimeException e) {
                    if (failure == null) {
                        failure = new ChangeDeliveryException(e);
                    } else if (failure.getCause() != e) {
                        failure.addSuppressed(e);
                    }
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * 订阅凭证；{@link #close()} 后不再收到事件。
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
