package org.memfs.filesystem;

import java.util.Locale;

/**
 * 文件大小格式化工具：按 1024 进位，保留两位小数（例如 {@code 5.00 B}、{@code 1.50 KB}）。
 */
public final class SizeFormat {

    private static final String[] UNITS = {"B", "KB", "MB", "GB"};

    private SizeFormat() {
    }

    public static String humanReadable(long bytes) {
        double size = bytes;
        for (String unit : UNITS) {
            if (size < 1024) {
                return String.format(Locale.ROOT, "%.2f %s", size, unit);
            }
            size /= 1024;
        }
        return String.format(Locale.ROOT, "%.2f TB", size);
    }

    /**
     * 内容预览：超过 {@code maxChars} 个字符时截断并追加 {@code ...}。
     */
    public static String preview(String content, int maxChars) {
        if (content == null) {
            return "";
        }
        if (content.length() <= maxChars) {
            return content;
        }
        int end = maxChars;
        // 不拆开代理对
        if (end > 0 && Character.isHighSurrogate(content.charAt(end - 1))) {
            end--;
        }
        return content.substring(0, end) + "...";
    }
}
