package org.memfs.mcp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.memfs.filesystem.ChangeJournal;
import org.memfs.filesystem.DuplicateNameException;
import org.memfs.filesystem.MemFsProperties;
import org.memfs.filesystem.NavigationController;
import org.memfs.filesystem.NodeKind;
import org.memfs.filesystem.NodeNotFoundException;
import org.memfs.filesystem.NodeStore;
import org.memfs.filesystem.PathResolver;
import org.memfs.filesystem.RootViolationException;
import org.memfs.filesystem.WrongKindException;
import org.memfs.filesystem.dto.ChangeLogResult;
import org.memfs.filesystem.dto.ChangeRecord;
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
import org.memfs.filesystem.event.ChangeNotificationBus;
import org.springframework.util.unit.DataSize;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemFsMcpToolsTest {

    private MemFsProperties properties;
    private NodeStore store;
    private MemFsMcpTools tools;

    @BeforeEach
    void setUp() {
        properties = new MemFsProperties();
        properties.setContentMaxBytes(DataSize.ofBytes(16));
        properties.setPreviewChars(5);
        ChangeNotificationBus bus = new ChangeNotificationBus();
        store = new NodeStore(bus);
        PathResolver resolver = new PathResolver(store, store.createNode(store.rootId(), "home", NodeKind.DIRECTORY).id());
        NavigationController navigation = new NavigationController(store, bus);
        ChangeJournal journal = new ChangeJournal(store, bus, Clock.systemUTC(), 100);
        tools = new MemFsMcpTools(properties, store, resolver, navigation, journal);
    }

    @Test
    void createListReadWrite_roundTripThroughPaths() {
        tools.create("/docs", "directory");
        NodeEntry created = tools.create("/docs/a.txt", "file");

        FileWriteResult written = tools.writeFile("/docs/a.txt", "hi");
        FileReadResult read = tools.readFile("/docs/a.txt");
        DirectoryListResult listed = tools.listDirectory("/docs", null, null, null, null);

        assertThat(created.path()).isEqualTo("/docs/a.txt");
        assertThat(created.file()).isTrue();
        assertThat(written.previousBytes()).isZero();
        assertThat(written.sizeBytes()).isEqualTo(2);
        assertThat(read.content()).isEqualTo("hi");
        assertThat(read.sizeBytes()).isEqualTo(2);
        assertThat(listed.entries()).extracting(NodeEntry::name).containsExactly("a.txt");
        assertThat(listed.entries().get(0).sizeBytes()).isEqualTo(2L);
    }

    @Test
    void create_relativeToCurrentDirectory() {
        tools.create("/work", "dir");
        tools.navigate("/work");

        NodeEntry entry = tools.create("notes.md", "file");

        assertThat(entry.path()).isEqualTo("/work/notes.md");
    }

    @Test
    void create_duplicateAndBadTypeAreRejected() {
        tools.create("/x", "file");

        assertThatThrownBy(() -> tools.create("/x", "directory"))
                .isInstanceOf(DuplicateNameException.class);
        assertThatThrownBy(() -> tools.create("/y", "symlink"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("symlink");
        assertThatThrownBy(() -> tools.create("/missing/z", "file"))
                .isInstanceOf(NodeNotFoundException.class);
    }

    @Test
    void listDirectory_pagesAndFilters() {
        tools.create("/d1", "directory");
        tools.create("/f1", "file");
        tools.create("/d2", "directory");
        tools.create("/f2", "file");

        DirectoryListResult firstPage = tools.listDirectory("/", 2, 0, null, null);
        DirectoryListResult secondPage = tools.listDirectory("/", 2, 2, null, null);
        DirectoryListResult dirsOnly = tools.listDirectory("/", null, null, true, null);

        assertThat(firstPage.entries()).extracting(NodeEntry::name).containsExactly("home", "d1");
        assertThat(firstPage.hasMore()).isTrue();
        assertThat(firstPage.total()).isEqualTo(5);
        assertThat(secondPage.entries()).extracting(NodeEntry::name).containsExactly("f1", "d2");
        assertThat(dirsOnly.entries()).extracting(NodeEntry::name).containsExactly("home", "d1", "d2");
        assertThatThrownBy(() -> tools.listDirectory("/", null, null, true, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tools.listDirectory("/f1", null, null, null, null))
                .isInstanceOf(WrongKindException.class);
    }

    @Test
    void listTree_walksPreOrderWithLimits() {
        tools.create("/a", "directory");
        tools.create("/a/b", "directory");
        tools.create("/a/b/deep.txt", "file");
        tools.create("/a/top.txt", "file");

        NodeTreeResult full = tools.listTree("/a", null, null, null);
        NodeTreeResult shallow = tools.listTree("/a", 1, null, null);
        NodeTreeResult dirsOnly = tools.listTree("/a", null, null, false);
        NodeTreeResult capped = tools.listTree("/a", null, 2, null);

        assertThat(full.entries()).extracting(NodeTreeEntry::path)
                .containsExactly("/a", "/a/b", "/a/b/deep.txt", "/a/top.txt");
        assertThat(full.entries()).extracting(NodeTreeEntry::depth).containsExactly(0, 1, 2, 1);
        assertThat(full.truncated()).isFalse();
        assertThat(shallow.entries()).extracting(NodeTreeEntry::path).containsExactly("/a", "/a/b", "/a/top.txt");
        assertThat(dirsOnly.entries()).extracting(NodeTreeEntry::path).containsExactly("/a", "/a/b");
        assertThat(capped.entries()).hasSize(2);
        assertThat(capped.truncated()).isTrue();
    }

    @Test
    void writeFile_enforcesKindAndSizeLimit() {
        tools.create("/dir", "directory");
        tools.create("/f.txt", "file");

        assertThatThrownBy(() -> tools.writeFile("/dir", "text"))
                .isInstanceOf(WrongKindException.class);
        assertThatThrownBy(() -> tools.writeFile("/f.txt", "this content is far too long"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("内容过大");
        assertThat(tools.readFile("/f.txt").content()).isEmpty();
    }

    @Test
    void properties_reportsSizeAndPreviewForFiles() {
        tools.create("/f.txt", "file");
        tools.writeFile("/f.txt", "hello world");

        NodePropertiesResult file = tools.properties("/f.txt");
        NodePropertiesResult root = tools.properties("/");

        assertThat(file.kind()).isEqualTo("file");
        assertThat(file.sizeBytes()).isEqualTo(11L);
        assertThat(file.sizeDisplay()).isEqualTo("11.00 B");
        assertThat(file.contentPreview()).isEqualTo("hello...");
        assertThat(file.childCount()).isNull();
        assertThat(root.kind()).isEqualTo("directory");
        assertThat(root.path()).isEqualTo("/");
        assertThat(root.sizeBytes()).isNull();
        assertThat(root.childCount()).isEqualTo(2);
    }

    @Test
    void navigation_backForwardUpAndHome() {
        tools.create("/a", "directory");
        tools.create("/a/b", "directory");

        tools.navigate("/a/b");
        NavigationResult home = tools.navigate("~");
        NavigationResult back = tools.back();
        NavigationResult forward = tools.forward();
        tools.back();
        NavigationResult up = tools.up();

        assertThat(home.currentPath()).isEqualTo("/home");
        assertThat(back.currentPath()).isEqualTo("/a/b");
        assertThat(back.canGoForward()).isTrue();
        assertThat(forward.currentPath()).isEqualTo("/home");
        assertThat(up.currentPath()).isEqualTo("/a");
        assertThat(up.canGoForward()).isFalse();
        assertThat(tools.forward().moved()).isFalse();
    }

    @Test
    void delete_resetsCurrentWhenItWasRemoved() {
        tools.create("/proj", "directory");
        tools.create("/proj/src", "directory");
        tools.create("/proj/src/Main.java", "file");
        tools.navigate("/proj/src");

        DeleteResult deleted = tools.delete("/proj");

        assertThat(deleted.removedCount()).isEqualTo(3);
        assertThat(deleted.directory()).isTrue();
        assertThat(deleted.currentPath()).isEqualTo("/");
        StatusResult status = tools.status();
        assertThat(status.currentPath()).isEqualTo("/");
        assertThat(status.historyDepth()).isEqualTo(1);
        assertThat(status.nodeCount()).isEqualTo(2);
        assertThatThrownBy(() -> tools.navigate("/proj/src"))
                .isInstanceOf(NodeNotFoundException.class);
        assertThatThrownBy(() -> tools.delete("/"))
                .isInstanceOf(RootViolationException.class);
    }

    @Test
    void rename_updatesPathAndRejectsRoot() {
        tools.create("/old", "directory");

        NodeEntry renamed = tools.rename("/old", "new");

        assertThat(renamed.path()).isEqualTo("/new");
        assertThatThrownBy(() -> tools.rename("/", "x"))
                .isInstanceOf(RootViolationException.class);
    }

    @Test
    void rename_toTildeIsRejectedWhileHomeIsConfigured() {
        tools.create("/notes.txt", "file");
        tools.create("/home/keep.txt", "file");

        assertThatThrownBy(() -> tools.rename("/notes.txt", "~"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("~");

        assertThat(tools.listDirectory("/", null, null, null, null).entries())
                .extracting(NodeEntry::name).containsExactly("home", "notes.txt");
        tools.delete("/notes.txt");
        assertThat(tools.readFile("~/keep.txt").path()).isEqualTo("/home/keep.txt");
    }

    @Test
    void pollChanges_returnsIncrementalRecords() {
        long start = tools.status().latestSequence();
        tools.create("/a.txt", "file");
        tools.writeFile("/a.txt", "x");

        ChangeLogResult changes = tools.pollChanges(start, null);
        ChangeLogResult none = tools.pollChanges(changes.latestSequence(), null);

        assertThat(changes.records()).extracting(ChangeRecord::type).containsExactly("inserted", "content_changed");
        assertThat(none.records()).isEmpty();
    }
}
