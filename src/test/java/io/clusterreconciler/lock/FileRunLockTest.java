package io.clusterreconciler.lock;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class FileRunLockTest {

    @TempDir
    Path tempDir;

    @Test
    void testLockFileSitsNextToArtifactRoot() {
        assertThat(FileRunLock.lockFileFor(tempDir.resolve("generated")))
                .isEqualTo(tempDir.toAbsolutePath().normalize().resolve("generated.lock"));
    }

    @Test
    void testSecondAcquireFailsWhileHeld() throws Exception {
        Path root = tempDir.resolve("generated");

        try (FileRunLock lock = FileRunLock.acquire(root)) {
            assertThat(Files.exists(lock.getLockFile())).isTrue();
            assertThatThrownBy(() -> FileRunLock.acquire(root))
                    .isInstanceOf(LockException.class)
                    .hasMessageContaining("generated.lock");
        }
    }

    @Test
    void testLockIsReusableAfterRelease() throws Exception {
        Path root = tempDir.resolve("generated");

        FileRunLock.acquire(root).close();

        try (FileRunLock again = FileRunLock.acquire(root)) {
            assertThat(again.getLockFile()).exists();
        }
    }
}
