package org.memfs.filesystem;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/**
 * 内存文件系统 MCP Server 的业务配置（{@code app.memfs.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #homeDirectory} 指定 {@code ~} 对应的 home 目录（启动时在根目录下创建）。</li>
 *   <li>通过各种 limit 配置控制返回体积，避免一次性返回过大的目录树。</li>
 *   <li>所有状态只存在于进程内存中，不存在任何持久化配置。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.memfs")
public class MemFsProperties {

    /**
     * home 目录名称（根目录下的一级目录）。
     * <p>
     * 说明：为空表示不配置 home，此时路径中的 {@code ~} 按普通名称处理。
     */
    private String homeDirectory = "home";

    /**
     * 是否在启动时创建示例目录（{@code /ROOT}）。
     */
    private boolean seedSampleTree = false;

    /**
     * 节点名称的最大字符数。
     */
    @Min(1)
    @Max(4_096)
    private int maxNameLength = NodeStore.DEFAULT_MAX_NAME_LENGTH;

    /**
     * {@code memfs_list_directory} 默认返回条数（分页大小）。
     */
    @Min(1)
    @Max(100_000)
    private int listDefaultLimit = 200;

    /**
     * {@code memfs_list_directory} 允许的最大返回条数（上限保护）。
     */
    @Min(1)
    @Max(100_000)
    private int listMaxLimit = 5_000;

    /**
     * {@code memfs_list_tree} 默认递归深度（0 表示只返回起始目录本身）。
     */
    @Min(0)
    @Max(1_000)
    private int treeDefaultDepth = 8;

    /**
     * {@code memfs_list_tree} 允许的最大递归深度（上限保护）。
     */
    @Min(0)
    @Max(1_000)
    private int treeMaxDepth = 32;

    /**
     * {@code memfs_list_tree} 默认最大条目数。
     */
    @Min(1)
    @Max(1_000_000)
    private int treeDefaultEntries = 10_000;

    /**
     * {@code memfs_list_tree} 允许的最大条目数（上限保护）。
     */
    @Min(1)
    @Max(1_000_000)
    private int treeMaxEntries = 50_000;

    /**
     * 单个文件内容的最大字节数（UTF-8）。
     */
    @NotNull
    private DataSize contentMaxBytes = DataSize.ofMegabytes(1);

    /**
     * {@code memfs_properties} 内容预览的最大字符数。
     */
    @Min(0)
    @Max(100_000)
    private int previewChars = 100;

    /**
     * 变更日志最多保留多少条记录（超过则淘汰最旧的）。
     */
    @Min(1)
    @Max(1_000_000)
    private int changeJournalCapacity = 1_000;

    public String getHomeDirectory() {
        return homeDirectory;
    }

    public void setHomeDirectory(String homeDirectory) {
        this.homeDirectory = homeDirectory;
    }

    public boolean isSeedSampleTree() {
        return seedSampleTree;
    }

    public void setSeedSampleTree(boolean seedSampleTree) {
        this.seedSampleTree = seedSampleTree;
    }

    public int getMaxNameLength() {
        return maxNameLength;
    }

    public void setMaxNameLength(int maxNameLength) {
        this.maxNameLength = maxNameLength;
    }

    public int getListDefaultLimit() {
        return listDefaultLimit;
    }

    public void setListDefaultLimit(int listDefaultLimit) {
        this.listDefaultLimit = listDefaultLimit;
    }

    public int getListMaxLimit() {
        return listMaxLimit;
    }

    public void setListMaxLimit(int listMaxLimit) {
        this.listMaxLimit = listMaxLimit;
    }

    public int getTreeDefaultDepth() {
        return treeDefaultDepth;
    }

    public void setTreeDefaultDepth(int treeDefaultDepth) {
        this.treeDefaultDepth = treeDefaultDepth;
    }

    public int getTreeMaxDepth() {
        return treeMaxDepth;
    }

    public void setTreeMaxDepth(int treeMaxDepth) {
        this.treeMaxDepth = treeMaxDepth;
    }

    public int getTreeDefaultEntries() {
        return treeDefaultEntries;
    }

    public void setTreeDefaultEntries(int treeDefaultEntries) {
        this.treeDefaultEntries = treeDefaultEntries;
    }

    public int getTreeMaxEntries() {
        return treeMaxEntries;
    }

    public void setTreeMaxEntries(int treeMaxEntries) {
        this.treeMaxEntries = treeMaxEntries;
    }

    public DataSize getContentMaxBytes() {
        return contentMaxBytes;
    }

    public void setContentMaxBytes(DataSize contentMaxBytes) {
        this.contentMaxBytes = contentMaxBytes;
    }

    public int getPreviewChars() {
        return previewChars;
    }

    public void setPreviewChars(int previewChars) {
        this.previewChars = previewChars;
    }

    public int getChangeJournalCapacity() {
        return changeJournalCapacity;
    }

    public void setChangeJournalCapacity(int changeJournalCapacity) {
        this.changeJournalCapacity = changeJournalCapacity;
    }
}
