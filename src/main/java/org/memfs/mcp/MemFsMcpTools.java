package org.memfs.mcp;

import org.memfs.filesystem.ChangeJournal;
import org.memfs.filesystem.MemFsProperties;
import org.memfs.filesystem.NavigationController;
import org.memfs.filesystem.Node;
import org.memfs.filesystem.NodeId;
import org.memfs.filesystem.NodeKind;
import org.memfs.filesystem.NodeStore;
import org.memfs.filesystem.PathResolver;
import org.memfs.filesystem.SizeFormat;
import org.memfs.filesystem.WrongKindException;
import org.memfs.filesystem.dto.ChangeLogResult;
import org.memfs.filesystem.dto.DeleteResult;
import org.memfs.filesystem.dto.DirectoryListResult;
import org.memfs.filesystem.dto.FileReadResult;
import org.memfs.filesystem.dto.FileWriteResult;
import org.memfs.filesystem.dto.NavigationResult;
import org.memfs.filesystem.dto.NodeEntry;
import org.memfs.filesystem.dto.NodePropertiesResult;
import org.memfs.filesystem.dto.NodeTreeEntry;
import org.memfs.filesystem.dto.NodeTreeResult;
import org.memfs.filesystem.dto.StatusResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 内存文件系统 MCP 工具集合（展示层）。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>浏览：列目录（{@code memfs_list_directory}）、目录树（{@code memfs_list_tree}）、属性（{@code memfs_properties}）。</li>
 *   <li>修改：创建、删除、重命名、读写文件内容。</li>
 *   <li>导航：进入目录、后退、前进、上级目录。</li>
 *   <li>同步：按序号增量拉取变更记录（{@code memfs_poll_changes}）。</li>
 * </ul>
 * <p>
 * 说明：
 * <ul>
 *   <li>相对路径都以导航的“当前目录”为起点；支持 {@code /}、{@code .}、{@code ..}、{@code ~}。</li>
 *   <li>树引擎不是线程安全的，所有工具方法在同一把锁上串行执行。</li>
 *   <li>所有状态只在内存中，进程退出即丢失。</li>
 * </ul>
 */
@Component
public class MemFsMcpTools {

    private static final Logger LOGGER = LoggerFactory.getLogger(MemFsMcpTools.class);

    private final MemFsProperties properties;
    private final NodeStore store;
    private final PathResolver pathResolver;
    private final NavigationController navigation;
    private final ChangeJournal journal;

    public MemFsMcpTools(
            MemFsProperties properties,
            NodeStore store,
            PathResolver pathResolver,
            NavigationController navigation,
            ChangeJournal journal
    ) {
        // properties：limit 上限、内容大小上限、预览长度等
        this.properties = properties;
        // store：树引擎，独占全部节点
        this.store = store;
        // pathResolver：把路径字符串解析为节点
        this.pathResolver = pathResolver;
        // navigation：当前目录与后退/前进历史
        this.navigation = navigation;
        // journal：变更日志，供客户端增量同步
        this.journal = journal;
    }

    @Tool(
            name = "memfs_status",
            description = "查看内存文件系统的当前状态：当前目录、home 目录、节点总数、历史深度、最新变更序号。"
    )
    public synchronized StatusResult status() {
        NodeId home = pathResolver.home();
        String homePath = store.exists(home) ? store.pathOf(home) : null;
        return new StatusResult(
                store.pathOf(navigation.currentId()),
                homePath,
                store.nodeCount(),
                navigation.history().size(),
                navigation.future().size(),
                journal.latestSequence()
        );
    }

    @Tool(
            name = "memfs_list_directory",
            description = "列出目录下的文件/子目录（非递归，按创建顺序，支持 limit/offset 分页）。"
    )
    /**
     * 列出目录内容（非递归）。
     * <p>
     * 目录非常大时，请使用 {@code limit/offset} 分页。
     */
    public synchronized DirectoryListResult listDirectory(
            @ToolParam(required = false, description = "目录路径（绝对路径或相对当前目录；为空则为当前目录）") String path,
            @ToolParam(required = false, description = "分页大小（默认 app.memfs.list-default-limit，上限 app.memfs.list-max-limit）") Integer limit,
            @ToolParam(required = false, description = "偏移量，从 0 开始") Integer offset,
            @ToolParam(required = false, description = "只返回目录（true/false）") Boolean onlyDirectories,
            @ToolParam(required = false, description = "只返回文件（true/false）") Boolean onlyFiles
    ) {
        Node dir = pathResolver.resolve(path, navigation.currentId());
        if (!dir.isDirectory()) {
            throw new WrongKindException(dir, NodeKind.DIRECTORY);
        }
        boolean onlyDirs = Boolean.TRUE.equals(onlyDirectories);
        boolean onlyFilesResolved = Boolean.TRUE.equals(onlyFiles);
        if (onlyDirs && onlyFilesResolved) {
            throw new IllegalArgumentException("参数冲突：onlyDirectories 和 onlyFiles 不能同时为 true");
        }

        int resolvedOffset = (offset == null) ? 0 : Math.max(0, offset);
        int resolvedLimit = resolveLimit(limit);

        List<Node> children = store.listChildren(dir.id());
        List<NodeEntry> entries = new ArrayList<>();
        boolean hasMore = false;
        int seen = 0;
        for (Node child : children) {
            if (onlyDirs && !child.isDirectory()) {
                continue;
            }
            if (onlyFilesResolved && !child.isFile()) {
                continue;
            }
            if (seen++ < resolvedOffset) {
                continue;
            }
            if (entries.size() >= resolvedLimit) {
                hasMore = true;
                break;
            }
            entries.add(toEntry(child));
        }
        return new DirectoryListResult(store.pathOf(dir.id()), resolvedOffset, resolvedLimit, children.size(), hasMore, entries);
    }

    @Tool(
            name = "memfs_list_tree",
            description = "递归列出目录树（先序遍历，支持 maxDepth/maxEntries；includeFiles=false 只返回目录）。"
    )
    public synchronized NodeTreeResult listTree(
            @ToolParam(required = false, description = "目录路径（绝对路径或相对当前目录；为空则为当前目录）") String path,
            @ToolParam(required = false, description = "最大深度（0=只返回起始目录；默认 app.memfs.tree-default-depth，上限 app.memfs.tree-max-depth）") Integer maxDepth,
            @ToolParam(required = false, description = "最大条目数（默认 app.memfs.tree-default-entries，上限 app.memfs.tree-max-entries）") Integer maxEntries,
            @ToolParam(required = false, description = "是否包含文件（默认 true；设为 false 仅返回目录）") Boolean includeFiles
    ) {
        Node base = pathResolver.resolve(path, navigation.currentId());
        if (!base.isDirectory()) {
            throw new WrongKindException(base, NodeKind.DIRECTORY);
        }
        int resolvedMaxDepth = resolveTreeMaxDepth(maxDepth);
        int resolvedMaxEntries = resolveTreeMaxEntries(maxEntries);
        boolean includeFilesResolved = (includeFiles == null) || includeFiles;

        List<NodeTreeEntry> entries = new ArrayList<>(Math.min(resolvedMaxEntries, 1024));
        boolean truncated = !walkTree(base, 0, resolvedMaxDepth, resolvedMaxEntries, includeFilesResolved, entries);
        return new NodeTreeResult(store.pathOf(base.id()), resolvedMaxDepth, resolvedMaxEntries, truncated, entries);
    }

    @Tool(
            name = "memfs_create",
            description = "按路径创建文件或目录（最后一段为新名称；不会自动创建缺失的父目录）。"
    )
    public synchronized NodeEntry create(
            @ToolParam(description = "新节点路径，例如 /docs/a.txt 或 notes（相对当前目录）") String path,
            @ToolParam(description = "类型：file 或 directory") String type
    ) {
        NodeKind kind = parseKind(type);
        PathResolver.CreateTarget target = pathResolver.resolveForCreate(path, navigation.currentId());
        Node node = store.createNode(target.parent().id(), target.name(), kind);
        LOGGER.info("已创建{}：{}", kind == NodeKind.DIRECTORY ? "目录" : "文件", store.pathOf(node.id()));
        return toEntry(node);
    }

    @Tool(
            name = "memfs_delete",
            description = "删除文件或目录（目录会连同全部内容一起删除；不允许删除根目录）。"
    )
    public synchronized DeleteResult delete(
            @ToolParam(description = "要删除的路径") String path
    ) {
        Node node = pathResolver.resolve(path, navigation.currentId());
        String displayPath = store.pathOf(node.id());
        boolean directory = node.isDirectory();
        int removed = store.deleteNode(node.id());
        LOGGER.info("已删除：{}（共 {} 个节点）", displayPath, removed);
        return new DeleteResult(displayPath, directory, removed, store.pathOf(navigation.currentId()));
    }

    @Tool(
            name = "memfs_rename",
            description = "重命名文件或目录（同一目录下不能重名；不允许重命名根目录）。"
    )
    public synchronized NodeEntry rename(
            @ToolParam(description = "要重命名的路径") String path,
            @ToolParam(description = "新名称（不能包含 /；配置了 home 时不能是 ~）") String newName
    ) {
        Node node = pathResolver.resolve(path, navigation.currentId());
        String oldPath = store.pathOf(node.id());
        pathResolver.checkNewName(newName);
        store.renameNode(node.id(), newName);
        LOGGER.info("已重命名：{} -> {}", oldPath, newName);
        return toEntry(node);
    }

    @Tool(
            name = "memfs_read_file",
            description = "读取文件的文本内容。"
    )
    public synchronized FileReadResult readFile(
            @ToolParam(description = "文件路径") String path
    ) {
        Node node = requireFile(pathResolver.resolve(path, navigation.currentId()));
        return new FileReadResult(store.pathOf(node.id()), node.size(), node.createdAt(), node.modifiedAt(), node.content());
    }

    @Tool(
            name = "memfs_write_file",
            description = "用新的文本内容整体替换文件内容（文件必须已存在；目录不能写入）。"
    )
    public synchronized FileWriteResult writeFile(
            @ToolParam(description = "文件路径") String path,
            @ToolParam(description = "新的文本内容（可以为空字符串）") String content
    ) {
        Node node = requireFile(pathResolver.resolve(path, navigation.currentId()));
        String text = (content == null) ? "" : content;
        long bytes = text.getBytes(StandardCharsets.UTF_8).length;
        long maxBytes = properties.getContentMaxBytes().toBytes();
        if (bytes > maxBytes) {
            throw new IllegalArgumentException("内容过大：" + bytes + " 字节（上限 " + maxBytes + "）");
        }
        long previous = node.size();
        store.updateContent(node.id(), text);
        LOGGER.info("已保存文件：{}（{} 字节）", store.pathOf(node.id()), bytes);
        return new FileWriteResult(store.pathOf(node.id()), previous, node.size(), node.modifiedAt());
    }

    @Tool(
            name = "memfs_properties",
            description = "查看节点属性：名称、类型、路径、创建/修改时间；文件额外返回大小与内容预览。"
    )
    public synchronized NodePropertiesResult properties(
            @ToolParam(required = false, description = "路径（为空则为当前目录）") String path
    ) {
        Node node = pathResolver.resolve(path, navigation.currentId());
        Long size = node.size();
        return new NodePropertiesResult(
                node.id().value(),
                node.name(),
                node.kind().displayName(),
                store.pathOf(node.id()),
                node.createdAt(),
                node.modifiedAt(),
                size,
                (size == null) ? null : SizeFormat.humanReadable(size),
                node.isFile() ? SizeFormat.preview(node.content(), properties.getPreviewChars()) : null,
                node.isDirectory() ? node.childIds().size() : null
        );
    }

    @Tool(
            name = "memfs_navigate",
            description = "进入指定目录（会清空“前进”历史）。"
    )
    public synchronized NavigationResult navigate(
            @ToolParam(description = "目录路径（绝对路径、相对路径、..、~ 均可）") String path
    ) {
        Node target = pathResolver.resolve(path, navigation.currentId());
        navigation.navigateTo(target.id());
        return navigationResult(true);
    }

    @Tool(
            name = "memfs_back",
            description = "后退到上一个访问过的目录（没有历史时不做任何事）。"
    )
    public synchronized NavigationResult back() {
        NodeId before = navigation.currentId();
        navigation.back();
        return navigationResult(!before.equals(navigation.currentId()));
    }

    @Tool(
            name = "memfs_forward",
            description = "前进到后退前的目录（没有前进历史时不做任何事）。"
    )
    public synchronized NavigationResult forward() {
        NodeId before = navigation.currentId();
        navigation.forward();
        return navigationResult(!before.equals(navigation.currentId()));
    }

    @Tool(
            name = "memfs_up",
            description = "进入上级目录（已在根目录时不做任何事）。"
    )
    public synchronized NavigationResult up() {
        NodeId before = navigation.currentId();
        navigation.up();
        return navigationResult(!before.equals(navigation.currentId()));
    }

    @Tool(
            name = "memfs_poll_changes",
            description = "按序号增量拉取变更记录（inserted/removed/renamed/content_changed）；首次调用传 0。"
    )
    public synchronized ChangeLogResult pollChanges(
            @ToolParam(required = false, description = "上次拿到的 latestSequence（默认 0）") Long afterSequence,
            @ToolParam(required = false, description = "最多返回多少条（默认 app.memfs.list-default-limit）") Integer limit
    ) {
        long after = (afterSequence == null) ? 0L : Math.max(0L, afterSequence);
        return journal.since(after, resolveLimit(limit));
    }

    private NavigationResult navigationResult(boolean moved) {
        return new NavigationResult(
                store.pathOf(navigation.currentId()),
                moved,
                navigation.canGoBack(),
                navigation.canGoForward(),
                navigation.history().size(),
                navigation.future().size()
        );
    }

    // 先序遍历；返回 false 表示因条目数上限被截断
    private boolean walkTree(Node node, int depth, int maxDepth, int maxEntries, boolean includeFiles, List<NodeTreeEntry> out) {
        if (out.size() >= maxEntries) {
            return false;
        }
        out.add(new NodeTreeEntry(depth, node.name(), store.pathOf(node.id()), node.isDirectory(), node.isFile(), node.size()));
        if (!node.isDirectory() || depth >= maxDepth) {
            return true;
        }
        for (Node child : store.listChildren(node.id())) {
            if (!includeFiles && child.isFile()) {
                continue;
            }
            if (!walkTree(child, depth + 1, maxDepth, maxEntries, includeFiles, out)) {
                return false;
            }
        }
        return true;
    }

    private NodeEntry toEntry(Node node) {
        return new NodeEntry(
                node.id().value(),
                node.name(),
                store.pathOf(node.id()),
                node.isDirectory(),
                node.isFile(),
                node.size(),
                node.createdAt(),
                node.modifiedAt()
        );
    }

    private static Node requireFile(Node node) {
        if (!node.isFile()) {
            throw new WrongKindException(node, NodeKind.FILE);
        }
        return node;
    }

    private static NodeKind parseKind(String type) {
        String normalized = (type == null) ? "" : type.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "file" -> NodeKind.FILE;
            case "directory", "dir", "folder" -> NodeKind.DIRECTORY;
            default -> throw new IllegalArgumentException("不支持的 type：" + type + "（请使用 file/directory）");
        };
    }

    private int resolveLimit(Integer limit) {
        // 分页上限保护：避免一次性返回过多条目
        int resolved = (limit == null) ? properties.getListDefaultLimit() : limit;
        resolved = Math.max(1, resolved);
        return Math.min(resolved, properties.getListMaxLimit());
    }

    private int resolveTreeMaxDepth(Integer maxDepth) {
        int resolved = (maxDepth == null) ? properties.getTreeDefaultDepth() : maxDepth;
        resolved = Math.max(0, resolved);
        return Math.min(resolved, properties.getTreeMaxDepth());
    }

    private int resolveTreeMaxEntries(Integer maxEntries) {
        // 目录树条目数上限保护：避免生成超大响应体
        int resolved = (maxEntries == null) ? properties.getTreeDefaultEntries() : maxEntries;
        resolved = Math.max(1, resolved);
        return Math.min(resolved, properties.getTreeMaxEntries());
    }
}
