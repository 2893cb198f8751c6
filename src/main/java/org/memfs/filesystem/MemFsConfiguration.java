package org.memfs.filesystem;

import org.memfs.filesystem.event.ChangeNotificationBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.util.StringUtils;

import java.time.Clock;

/**
 * 内存文件系统的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>整个进程只有一棵树：{@link NodeStore} 独占节点，其余组件只持有句柄。</li>
 *   <li>home 目录与示例目录在这里按 {@link MemFsProperties} 创建。</li>
 *   <li>这里不引入任何数据库/磁盘依赖，进程退出后状态全部丢失。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class MemFsConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(MemFsConfiguration.class);

    static final String SAMPLE_DIRECTORY = "ROOT";

    @Bean
    public Clock memFsClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ChangeNotificationBus changeNotificationBus() {
        return new ChangeNotificationBus();
    }

    @Bean
    public NodeStore nodeStore(ChangeNotificationBus bus, Clock memFsClock, MemFsProperties properties) {
        return new NodeStore(bus, memFsClock, properties.getMaxNameLength());
    }

    /**
     * 创建启动时的目录（示例目录、home 目录）。变更日志需先订阅总线，否则这些 inserted 记录不会进入日志。
     */
    @Bean
    @DependsOn("changeJournal")
    public PathResolver pathResolver(NodeStore store, MemFsProperties properties) {
        if (properties.isSeedSampleTree() && store.findChild(store.rootId(), SAMPLE_DIRECTORY) == null) {
            store.createNode(store.rootId(), SAMPLE_DIRECTORY, NodeKind.DIRECTORY);
            LOGGER.info("已创建示例目录：/{}", SAMPLE_DIRECTORY);
        }
        String homeName = properties.getHomeDirectory();
        if (!StringUtils.hasText(homeName)) {
            LOGGER.info("未配置 home 目录，路径中的 ~ 将按普通名称解析");
            return new PathResolver(store);
        }
        Node existing = store.findChild(store.rootId(), homeName.trim());
        Node home = (existing != null) ? existing : store.createNode(store.rootId(), homeName.trim(), NodeKind.DIRECTORY);
        if (!home.isDirectory()) {
            throw new IllegalStateException("home 目录名称与已有文件冲突：" + homeName);
        }
        LOGGER.info("home 目录：{}", store.pathOf(home.id()));
        return new PathResolver(store, home.id());
    }

    @Bean
    public NavigationController navigationController(NodeStore store, ChangeNotificationBus bus) {
        return new NavigationController(store, bus);
    }

    @Bean
    public ChangeJournal changeJournal(NodeStore store, ChangeNotificationBus bus, Clock memFsClock, MemFsProperties properties) {
        return new ChangeJournal(store, bus, memFsClock, properties.getChangeJournalCapacity());
    }
}
