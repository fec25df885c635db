package io.clusterreconciler.lock;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static io.clusterreconciler.config.Constants.LOCK_SUFFIX;

/**
 * Exclusive lock on {@code <artifact-root>.lock} held for the duration of a run.
 * Released on close; the lock file itself is left in place.
 */
@Slf4j
public class FileRunLock implements AutoCloseable {
    
    private final Path lockFile;
    private final FileChannel channel;
    private final FileLock lock;
    
    private FileRunLock(Path lockFile, FileChannel channel, FileLock lock) {
        this.lockFile = lockFile;
        this.channel = channel;
        this.lock = lock;
    }
    
    public static Path lockFileFor(Path artifactRoot) {
        Path root = artifactRoot.toAbsolutePath().normalize();
        return root.resolveSibling(root.getFileName() + LOCK_SUFFIX);
    }
    
    /**
     * Take the lock without waiting.
     *
     * @throws LockException if another run holds it or the lock file cannot be opened
     */
    public static FileRunLock acquire(Path artifactRoot) throws LockException {
        Path lockFile = lockFileFor(artifactRoot);
        FileChannel channel;
        try {
            Files.createDirectories(lockFile.getParent());
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new LockException("Failed to open lock file " + lockFile, e);
        }
        
        try {
            FileLock lock = channel.tryLock();
            if (lock == null) {
                closeQuietly(channel);
                throw new LockException("Another run holds " + lockFile);
            }
            log.debug("Acquired run lock {}", lockFile);
            return new FileRunLock(lockFile, channel, lock);
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            throw new LockException("Another run in this process holds " + lockFile, e);
        } catch (IOException e) {
            closeQuietly(channel);
            throw new LockException("Failed to lock " + lockFile, e);
        }
    }
    
    public Path getLockFile() {
        return lockFile;
    }
    
    @Override
    public void close() throws LockException {
        try {
            lock.release();
            channel.close();
            log.debug("Released run lock {}", lockFile);
        } catch (IOException e) {
            throw new LockException("Failed to release " + lockFile, e);
        }
    }
    
    private static void closeQuietly(FileChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Failed to close lock channel: {}", e.getMessage());
        }
    }
}
