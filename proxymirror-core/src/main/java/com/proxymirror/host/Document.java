package com.proxymirror.host;

import com.proxymirror.Parser;
import com.proxymirror.ast.SourceFile;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * A parsed source file guarded by a read/write lock. Reads go through {@link #read};
 * modifications of the tree happen inside {@link #acquireWrite()}.
 */
public class Document implements WriteScopeProvider {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private SourceFile file;

    /**
     * @throws com.proxymirror.ParseException if {@code text} cannot be parsed
     */
    public Document(String text) {
        this.file = Parser.parse(text);
    }

    public <T> T read(Function<SourceFile, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(file);
        } finally {
            lock.readLock().unlock();
        }
    }

    public String text() {
        return read(SourceFile::text);
    }

    /**
     * The current tree. Callers outside a scope get no protection against concurrent edits.
     */
    public SourceFile file() {
        return file;
    }

    @Override
    public WriteScope acquireWrite() {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        return new LockScope(writeLock);
    }

    public boolean isWriteLocked() {
        return lock.isWriteLocked();
    }

    /**
     * Replaces the tree with a fresh parse of {@code snapshot}. Requires the write scope.
     */
    public void restore(String snapshot) {
        if (!lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("restore requires the write scope");
        }
        this.file = Parser.parse(snapshot);
    }

    /**
     * Converts a 1-based line and column into an offset into the text.
     */
    public int offsetOf(int line, int column) {
        String text = text();
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Line and column are 1-based, got " + line + ":" + column);
        }
        int lineStart = 0;
        for (int current = 1; current < line; current++) {
            int newline = text.indexOf('\n', lineStart);
            if (newline < 0) {
                throw new IllegalArgumentException("Line " + line + " is past the end of the document");
            }
            lineStart = newline + 1;
        }
        int lineEnd = text.indexOf('\n', lineStart);
        if (lineEnd < 0) {
            lineEnd = text.length();
        }
        int offset = lineStart + column - 1;
        if (offset > lineEnd) {
            throw new IllegalArgumentException("Column " + column + " is past the end of line " + line);
        }
        return offset;
    }

    private static final class LockScope implements WriteScope {
        private final Lock lock;
        private boolean closed;

        LockScope(Lock lock) {
            this.lock = lock;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                lock.unlock();
            }
        }
    }
}
