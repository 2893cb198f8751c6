package org.memfs.filesystem;

import org.memfs.filesystem.dto.ChangeLogResult;
import org.memfs.filesystem.dto.ChangeRecord;
import org.memfs.filesystem.event.ChangeListener;
import org.memfs.filesystem.event.ChangeNotificationBus;
import org.memfs.filesystem.event.NodeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 变更日志（内存版，有容量上限）：订阅变更总线，把每个事件记录成带序号的 {@link ChangeRecord}。
 * <p>
 * 工作流：
 * <ol>
 *   <li>客户端第一次调用 {@code memfs_poll_changes} 时传 0，拿到 latestSequence。</li>
 *   <li>之后每次传入上次的 latestSequence，只取增量。</li>
 *   <li>如果返回 {@code gap=true}，说明中间的记录已被淘汰，客户端应重新列目录。</li>
 * </ol>
 */
public class ChangeJournal implements ChangeListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeJournal.class);

    private final NodeStore store;
    private final Clock clock;
    private final int capacity;
    private final Deque<ChangeRecord> records = new ArrayDeque<>();

    private long latestSequence;
    private long evictedThrough;

    public ChangeJournal(NodeStore store, ChangeNotificationBus bus, Clock clock, int capacity) {
        this.store = store;
        this.clock = clock;
        this.capacity = Math.max(1, capacity);
        bus.subscribe(this);
    }

    @Override
    public void onChange(NodeEvent event) {
        ChangeRecord record = toRecord(++latestSequence, event);
        records.addLast(record);
        while (records.size() > capacity) {
            evictedThrough = records.removeFirst().sequence();
        }
        LOGGER.debug("变更 #{} {} {}", record.sequence(), record.type(), record.path());
    }

    public long latestSequence() {
        return latestSequence;
    }

    /**
     * 返回序号大于 {@code afterSequence} 的记录（旧的在前），最多 {@code limit} 条。
     */
    public ChangeLogResult since(long afterSequence, int limit) {
        int resolvedLimit = Math.max(1, limit);
        List<ChangeRecord> result = new ArrayList<>(Math.min(resolvedLimit, records.size()));
        boolean hasMore = false;
        for (ChangeRecord record : records) {
            if (record.sequence() <= afterSequence) {
                continue;
            }
            if (result.size() >= resolvedLimit) {
                hasMore = true;
                break;
            }
            result.add(record);
        }
        boolean gap = afterSequence < evictedThrough;
        return new ChangeLogResult(afterSequence, latestSequence, hasMore, gap, result);
    }

    private ChangeRecord toRecord(long sequence, NodeEvent event) {
        if (event instanceof NodeEvent.Inserted inserted) {
            Node node = inserted.node();
            return new ChangeRecord(sequence, "inserted", node.id().value(), inserted.parentId().value(),
                    node.kind().displayName(), store.pathOf(node.id()), null, clock.instant());
        }
        if (event instanceof NodeEvent.Removed removed) {
            Long parentId = (removed.parentId() == null) ? null : removed.parentId().value();
            return new ChangeRecord(sequence, "removed", removed.nodeId().value(), parentId,
                    removed.kind().displayName(), removed.path(), null, clock.instant());
        }
        if (event instanceof NodeEvent.Renamed renamed) {
            Node node = renamed.node();
            return new ChangeRecord(sequence, "renamed", node.id().value(), node.parentId().value(),
                    node.kind().displayName(), store.pathOf(node.id()), renamed.oldName(), clock.instant());
        }
        NodeEvent.ContentChanged changed = (NodeEvent.ContentChanged) event;
        Node node = changed.node();
        return new ChangeRecord(sequence, "content_changed", node.id().value(), node.parentId().value(),
                node.kind().displayName(), store.pathOf(node.id()), null, clock.instant());
    }
}
