package org.memfs.filesystem;

/**
 * 试图删除或重命名根目录。
 */
public class RootViolationException extends FileSystemException {

    public RootViolationException(String operation) {
        super("不允许" + operation + "根目录");
    }
}
