package org.memfs.filesystem;

import org.memfs.filesystem.event.ChangeListener;
import org.memfs.filesystem.event.ChangeNotificationBus;
import org.memfs.filesystem.event.NodeEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * 导航控制器：维护“当前目录”以及后退/前进历史。
 * <p>
 * 状态机：
 * <ul>
 *   <li>{@link #navigateTo(NodeId)}：当前目录压入后退栈，清空前进栈，切换到目标目录。</li>
 *   <li>{@link #back()} / {@link #forward()}：在两个栈之间移动当前目录；对应栈为空时不做任何事。</li>
 *   <li>{@link #up()}：等价于导航到父目录；已在根目录时不做任何事。</li>
 * </ul>
 * <p>
 * 两个栈只保存句柄。控制器订阅变更总线：收到 Removed 事件时把被删除的句柄从两个栈中清除，
 * 如果当前目录被删除则回到根目录。
 */
public class NavigationController implements ChangeListener {

    private final NodeStore store;
    private final Deque<NodeId> history = new ArrayDeque<>();
    private final Deque<NodeId> future = new ArrayDeque<>();
    private NodeId current;

    public NavigationController(NodeStore store, ChangeNotificationBus bus) {
        this.store = Objects.requireNonNull(store, "store");
        this.current = store.rootId();
        bus.subscribe(this);
    }

    public Node current() {
        return store.get(current);
    }

    public NodeId currentId() {
        return current;
    }

    /**
     * @throws NodeNotFoundException 目标句柄已失效
     * @throws WrongKindException    目标不是目录
     */
    public Node navigateTo(NodeId target) {
        Node node = store.get(target);
        if (!node.isDirectory()) {
            throw new WrongKindException(node, NodeKind.DIRECTORY);
        }
        history.push(current);
        future.clear();
        current = node.id();
        return node;
    }

    public Node back() {
        NodeId previous = popLive(history);
        if (previous != null) {
            future.push(current);
            current = previous;
        }
        return current();
    }

    public Node forward() {
        NodeId next = popLive(future);
        if (next != null) {
            history.push(current);
            current = next;
        }
        return current();
    }

    public Node up() {
        NodeId parent = current().parentId();
        if (parent == null) {
            return current();
        }
        return navigateTo(parent);
    }

    public boolean canGoBack() {
        return history.stream().anyMatch(store::exists);
    }

    public boolean canGoForward() {
        return future.stream().anyMatch(store::exists);
    }

    /**
     * 后退栈快照（最早访问的在前）。
     */
    public List<NodeId> history() {
        return oldestFirst(history);
    }

    /**
     * 前进栈快照（最远的在前，最近一次后退离开的在末尾）。
     */
    public List<NodeId> future() {
        return oldestFirst(future);
    }

    @Override
    public void onChange(NodeEvent event) {
        if (event instanceof NodeEvent.Removed removed) {
            scrub(removed.nodeId());
        }
    }

    private void scrub(NodeId removed) {
        history.removeIf(removed::equals);
        future.removeIf(removed::equals);
        if (removed.equals(current)) {
            current = store.rootId();
        }
    }

    // 事件清理之外再做一次句柄有效性检查，跳过已失效的条目
    private NodeId popLive(Deque<NodeId> stack) {
        while (!stack.isEmpty()) {
            NodeId candidate = stack.pop();
            if (store.exists(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static List<NodeId> oldestFirst(Deque<NodeId> stack) {
        List<NodeId> result = new ArrayList<>(stack);
        Collections.reverse(result);
        return result;
    }
}
