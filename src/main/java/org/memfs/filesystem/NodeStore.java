package org.memfs.filesystem;

import org.memfs.filesystem.event.ChangeNotificationBus;
import org.memfs.filesystem.event.NodeEvent;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 树引擎：独占内存文件系统的全部节点，负责创建、删除、重命名、更新内容与列出子节点。
 * <p>
 * 设计要点：
 * <ul>
 *   <li>节点放在以 {@link NodeId} 为键的表里，父子关系只保存句柄，不存在对象之间的互相引用。</li>
 *   <li>每个目录维护一个有序的子节点句柄列表，新节点总是追加到末尾（列出顺序即创建顺序）。</li>
 *   <li>每个操作先完成全部校验再修改；失败时树保持调用前的状态。</li>
 *   <li>修改完成后才通过 {@link ChangeNotificationBus} 发出事件。</li>
 * </ul>
 * <p>
 * 注意：本类不是线程安全的，并发调用方需要在外部串行化。
 */
public class NodeStore {

    public static final NodeId ROOT_ID = new NodeId(0);

    public static final int DEFAULT_MAX_NAME_LENGTH = 256;

    private final ChangeNotificationBus bus;
    private final Clock clock;
    private final int maxNameLength;

    private final Map<NodeId, Node> nodes = new HashMap<>();
    private final Node root;
    private long nextId = ROOT_ID.value() + 1;

    public NodeStore(ChangeNotificationBus bus) {
        this(bus, Clock.systemUTC(), DEFAULT_MAX_NAME_LENGTH);
    }

    public NodeStore(ChangeNotificationBus bus, Clock clock, int maxNameLength) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxNameLength = maxNameLength;
        this.root = new Node(ROOT_ID, null, "", NodeKind.DIRECTORY, clock.instant());
        nodes.put(ROOT_ID, root);
    }

    public Node root() {
        return root;
    }

    public NodeId rootId() {
        return ROOT_ID;
    }

    public boolean exists(NodeId id) {
        return id != null && nodes.containsKey(id);
    }

    /**
     * 按句柄取节点。
     *
     * @throws NodeNotFoundException 句柄已失效
     */
    public Node get(NodeId id) {
        Node node = (id == null) ? null : nodes.get(id);
        if (node == null) {
            throw NodeNotFoundException.forHandle(id);
        }
        return node;
    }

    /**
     * 当前存活的节点总数（含根）。
     */
    public int nodeCount() {
        return nodes.size();
    }

    /**
     * 在 {@code parentId} 目录下按名称查找直接子节点，不存在返回 null。
     */
    public Node findChild(NodeId parentId, String name) {
        Node parent = get(parentId);
        for (NodeId childId : parent.children()) {
            Node child = nodes.get(childId);
            if (child.name().equals(name)) {
                return child;
            }
        }
        return null;
    }

    /**
     * 按插入顺序列出子节点。返回的是快照，可重复遍历，不会修改树。
     *
     * @throws WrongKindException 节点是文件
     */
    public List<Node> listChildren(NodeId parentId) {
        Node parent = requireDirectory(get(parentId));
        List<Node> result = new ArrayList<>(parent.children().size());
        for (NodeId childId : parent.children()) {
            result.add(nodes.get(childId));
        }
        return result;
    }

    /**
     * 节点的绝对路径（根为 {@code /}）。
     */
    public String pathOf(NodeId id) {
        Node node = get(id);
        if (node.isRoot()) {
            return "/";
        }
        Deque<String> names = new ArrayDeque<>();
        while (!node.isRoot()) {
            names.addFirst(node.name());
            node = nodes.get(node.parentId());
        }
        return "/" + String.join("/", names);
    }

    /**
     * 以该节点为根的子树包含的节点数（含自身）。
     */
    public int subtreeSize(NodeId id) {
        return postOrder(get(id)).size();
    }

    public Node createNode(NodeId parentId, String name, NodeKind kind) {
        Objects.requireNonNull(kind, "kind");
        Node parent = requireDirectory(get(parentId));
        validateName(name);
        if (findChild(parentId, name) != null) {
            throw new DuplicateNameException(parentId, name);
        }

        Node node = new Node(new NodeId(nextId++), parentId, name, kind, clock.instant());
        nodes.put(node.id(), node);
        parent.children().add(node.id());

        bus.publish(new NodeEvent.Inserted(parentId, node));
        return node;
    }

    /**
     * 删除节点；目录会先按后序销毁整棵子树（叶子先于父目录），再把自身从父目录的子节点列表中摘除。
     * <p>
     * 子树删除产生的 Removed 事件按销毁顺序收集，整棵子树删除完成后一次性交给总线。
     *
     * @return 被销毁的节点数（含自身）
     * @throws RootViolationException 试图删除根目录
     */
    public int deleteNode(NodeId id) {
        Node node = get(id);
        if (node.isRoot()) {
            throw new RootViolationException("删除");
        }

        // 先记录快照：销毁后路径与父链都不可再计算
        List<Node> order = postOrder(node);
        List<NodeEvent.Removed> events = new ArrayList<>(order.size());
        for (Node victim : order) {
            events.add(new NodeEvent.Removed(victim.parentId(), victim.id(), victim.name(), victim.kind(), pathOf(victim.id())));
        }

        for (Node victim : order) {
            if (victim != node) {
                destroy(victim);
            }
        }
        Node parent = nodes.get(node.parentId());
        parent.children().remove(node.id());
        destroy(node);

        bus.publishAll(events);
        return order.size();
    }

    /**
     * @throws RootViolationException 试图重命名根目录
     * @throws DuplicateNameException 与其他兄弟节点重名
     */
    public void renameNode(NodeId id, String newName) {
        Node node = get(id);
        if (node.isRoot()) {
            throw new RootViolationException("重命名");
        }
        validateName(newName);
        String oldName = node.name();
        if (oldName.equals(newName)) {
            return;
        }
        Node clash = findChild(node.parentId(), newName);
        if (clash != null && clash != node) {
            throw new DuplicateNameException(node.parentId(), newName);
        }

        node.rename(newName);
        bus.publish(new NodeEvent.Renamed(node, oldName));
    }

    /**
     * 替换文件内容，大小按 UTF-8 字节数重新计算，修改时间单调不减。
     *
     * @throws WrongKindException 节点是目录
     */
    public void updateContent(NodeId id, String text) {
        Node node = get(id);
        if (!node.isFile()) {
            throw new WrongKindException(node, NodeKind.FILE);
        }
        String content = (text == null) ? "" : text;
        long size = content.getBytes(StandardCharsets.UTF_8).length;

        Instant now = clock.instant();
        Instant modifiedAt = now.isBefore(node.modifiedAt()) ? node.modifiedAt() : now;
        node.replaceContent(content, size, modifiedAt);

        bus.publish(new NodeEvent.ContentChanged(node));
    }

    private void destroy(Node node) {
        nodes.remove(node.id());
        node.detach();
    }

    private List<Node> postOrder(Node start) {
        List<Node> order = new ArrayList<>();
        // 迭代实现，避免深层目录导致栈溢出：第二次弹出时才输出节点
        Deque<Node> stack = new ArrayDeque<>();
        Deque<Boolean> expanded = new ArrayDeque<>();
        stack.push(start);
        expanded.push(Boolean.FALSE);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            boolean seen = expanded.pop();
            if (seen || !node.isDirectory() || node.children().isEmpty()) {
                order.add(node);
                continue;
            }
            stack.push(node);
            expanded.push(Boolean.TRUE);
            List<NodeId> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(nodes.get(children.get(i)));
                expanded.push(Boolean.FALSE);
            }
        }
        return order;
    }

    private Node requireDirectory(Node node) {
        if (!node.isDirectory()) {
            throw new WrongKindException(node, NodeKind.DIRECTORY);
        }
        return node;
    }

    private void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("参数错误：名称不能为空");
        }
        if (name.indexOf('/') >= 0) {
            throw new IllegalArgumentException("参数错误：名称不能包含路径分隔符 /：" + name);
        }
        if (".".equals(name) || "..".equals(name)) {
            throw new IllegalArgumentException("参数错误：名称不能是 . 或 ..");
        }
        if (name.length() > maxNameLength) {
            throw new IllegalArgumentException("名称过长：" + name.length() + " 个字符（上限 " + maxNameLength + "）");
        }
    }
}
