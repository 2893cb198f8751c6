package org.memfs.filesystem.event;

import org.junit.jupiter.api.Test;
import org.memfs.filesystem.FileSystemException;
import org.memfs.filesystem.Node;
import org.memfs.filesystem.NodeKind;
import org.memfs.filesystem.NodeStore;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class ChangeNotificationBusTest {

    @Test
    void publish_deliversToListenersInSubscriptionOrder() {
        ChangeNotificationBus bus = new ChangeNotificationBus();
        NodeStore store = new NodeStore(bus);
        List<String> calls = new ArrayList<>();
        bus.subscribe(event -> calls.add("first"));
        bus.subscribe(event -> calls.add("second"));

        store.createNode(store.rootId(), "a", NodeKind.FILE);

        assertThat(calls).containsExactly("first", "second");
    }

    @Test
    void subscriptionClose_stopsDelivery() {
        ChangeNotificationBus bus = new ChangeNotificationBus();
        NodeStore store = new NodeStore(bus);
        List<NodeEvent> received = new ArrayList<>();
        ChangeNotificationBus.Subscription subscription = bus.subscribe(received::add);

        store.createNode(store.rootId(), "a", NodeKind.FILE);
        subscription.close();
        store.createNode(store.rootId(), "b", NodeKind.FILE);

        assertThat(received).hasSize(1);
        assertThat(bus.subscriberCount()).isZero();
    }

    @Test
    void failingListener_doesNotBlockOthersAndMutationStaysCommitted() {
        ChangeNotificationBus bus = new ChangeNotificationBus();
        NodeStore store = new NodeStore(bus);
        List<NodeEvent> received = new ArrayList<>();
        bus.subscribe(event -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(received::add);

        assertThatThrownBy(() -> store.createNode(store.rootId(), "a", NodeKind.FILE))
                .isInstanceOf(ChangeDeliveryException.class)
                .hasMessageContaining("已提交")
                .hasMessageContaining("boom")
                .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(received).hasSize(1);
        assertThat(store.findChild(store.rootId(), "a")).isNotNull();
    }

    @Test
    void failingListener_isDistinguishableFromARejectedMutation() {
        ChangeNotificationBus bus = new ChangeNotificationBus();
        NodeStore store = new NodeStore(bus);
        Node file = store.createNode(store.rootId(), "a.txt", NodeKind.FILE);
        bus.subscribe(event -> {
            throw new IllegalStateException("boom");
        });

        Throwable thrown = catchThrowable(() -> store.updateContent(file.id(), "hello"));

        assertThat(thrown).isInstanceOf(ChangeDeliveryException.class).isNotInstanceOf(FileSystemException.class);
        assertThat(file.content()).isEqualTo("hello");
        assertThat(file.size()).isEqualTo(5L);
    }

    @Test
    void sameFailureFromSeveralEvents_isReportedOnce() {
        ChangeNotificationBus bus = new ChangeNotificationBus();
        NodeStore store = new NodeStore(bus);
        Node dir = store.createNode(store.rootId(), "dir", NodeKind.DIRECTORY);
        store.createNode(dir.id(), "one", NodeKind.FILE);
        IllegalStateException shared = new IllegalStateException("shared");
        bus.subscribe(event -> {
            throw shared;
        });

        Throwable thrown = catchThrowable(() -> store.deleteNode(dir.id()));

        assertThat(thrown).isInstanceOf(ChangeDeliveryException.class).hasCause(shared);
        assertThat(thrown.getSuppressed()).isEmpty();
    }

    @Test
    void publishAll_reportsLaterFailuresAsSuppressed() {
        ChangeNotificationBus bus = new ChangeNotificationBus();
        NodeStore store = new NodeStore(bus);
        Node dir = store.createNode(store.rootId(), "dir", NodeKind.DIRECTORY);
        store.createNode(dir.id(), "one", NodeKind.FILE);
        store.createNode(dir.id(), "two", NodeKind.FILE);
        List<NodeEvent> received = new ArrayList<>();
        bus.subscribe(event -> {
            throw new IllegalStateException("failed " + event.nodeId());
        });
        bus.subscribe(received::add);

        Throwable thrown = catchThrowable(() -> store.deleteNode(dir.id()));

        assertThat(thrown).isInstanceOf(ChangeDeliveryException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(thrown.getSuppressed()).hasSize(2);

        assertThat(received).hasSize(3).allMatch(event -> event instanceof NodeEvent.Removed);
        assertThat(store.listChildren(store.rootId())).isEmpty();
    }
}
