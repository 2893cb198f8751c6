package org.memfs.filesystem;

import java.util.Objects;

/**
 * 路径解析器：把用户输入的路径字符串解析成 {@link Node}。
 * <p>
 * 规则：
 * <ul>
 *   <li>按 {@code /} 切分，空段忽略（多余的前导/结尾/重复斜杠都无害）。</li>
 *   <li>以 {@code /} 开头为绝对路径，从根开始；否则从调用方传入的当前节点开始。</li>
 *   <li>{@code .} 保持不动；{@code ..} 回到父节点（已在根则不动）。</li>
 *   <li>{@code ~} 跳到配置的 home 目录；未配置 home 时 {@code ~} 按普通名称处理。</li>
 *   <li>遇到第一个不存在的段即失败，异常中携带原始路径。</li>
 * </ul>
 */
public class PathResolver {

    public static final String HOME = "~";

    private final NodeStore store;
    private final NodeId home;

    public PathResolver(NodeStore store) {
        this(store, null);
    }

    /**
     * @param store 树引擎
     * @param home  home 目录句柄；为 null 表示未配置
     */
    public PathResolver(NodeStore store, NodeId home) {
        this.store = Objects.requireNonNull(store, "store");
        this.home = home;
    }

    public NodeId home() {
        return home;
    }

    /**
     * 从根目录解析（相对路径也按根目录为起点）。
     */
    public Node resolve(String path) {
        return resolve(path, store.rootId());
    }

    /**
     * @param path    路径；null 或空白时返回起点本身
     * @param current 相对路径的起点
     * @throws NodeNotFoundException 某一段不存在
     */
    public Node resolve(String path, NodeId current) {
        if (path == null || path.isBlank()) {
            return store.get(current);
        }
        Node running = path.startsWith("/") ? store.root() : store.get(current);
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (running.parentId() != null) {
                    running = store.get(running.parentId());
                }
                continue;
            }
            if (HOME.equals(segment) && home != null) {
                if (!store.exists(home)) {
                    throw new NodeNotFoundException(path);
                }
                running = store.get(home);
                continue;
            }
            Node child = running.isDirectory() ? store.findChild(running.id(), segment) : null;
            if (child == null) {
                throw new NodeNotFoundException(path);
            }
            running = child;
        }
        return running;
    }

    /**
     * 为“按路径创建”拆出父目录与新名称：最后一段是新名称，前缀按普通路径解析为父目录。
     * <p>
     * 不会自动创建缺失的中间目录。
     *
     * @throws NodeNotFoundException    父目录不存在
     * @throws WrongKindException       父路径指向文件
     * @throws IllegalArgumentException 没有给出名称，或名称是 {@code .}/{@code ..}
     */
    public CreateTarget resolveForCreate(String path, NodeId current) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("参数错误：path 不能为空");
        }
        String trimmed = path;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = trimmed.lastIndexOf('/');
        String name = trimmed.substring(slash + 1);
        if (name.isEmpty() || ".".equals(name) || "..".equals(name)) {
            throw new IllegalArgumentException("参数错误：路径中缺少要创建的名称：" + path);
        }
        checkNewName(name);

        Node parent;
        if (slash < 0) {
            parent = store.get(current);
        } else {
            String parentPath = (slash == 0) ? "/" : trimmed.substring(0, slash);
            parent = resolve(parentPath, current);
        }
        if (!parent.isDirectory()) {
            throw new WrongKindException(parent, NodeKind.DIRECTORY);
        }
        return new CreateTarget(parent, name);
    }

    /**
     * 校验新名称（创建与重命名共用）：配置了 home 时 {@code ~} 是保留名。
     *
     * @throws IllegalArgumentException 名称是保留名
     */
    public void checkNewName(String name) {
        if (home != null && HOME.equals(name)) {
            throw new IllegalArgumentException("参数错误：" + HOME + " 表示 home 目录，不能用作名称");
        }
    }

    /**
     * 按路径创建的目标：父目录 + 新节点名称。
     */
    public record CreateTarget(Node parent, String name) {
    }
}
