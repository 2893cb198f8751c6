package org.memfs.filesystem.dto;

/**
 * 导航类工具（navigate/back/forward/up）的返回结果。
 *
 * @param currentPath  当前目录的绝对路径
 * @param moved        本次调用是否改变了当前目录
 * @param canGoBack    是否可以后退
 * @param canGoForward 是否可以前进
 * @param historyDepth 后退栈深度
 * @param futureDepth  前进栈深度
 */
public record NavigationResult(
        String currentPath,
        boolean moved,
        boolean canGoBack,
        boolean canGoForward,
        int historyDepth,
        int futureDepth
) {
}
