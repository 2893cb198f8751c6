package org.memfs.filesystem;

/**
 * 内存文件系统操作失败的基类。
 * <p>
 * 所有子类都是“可在调用处恢复”的错误：抛出前不会对树做任何修改。
 */
public abstract class FileSystemException extends RuntimeException {

    protected FileSystemException(String message) {
        super(message);
    }
}
