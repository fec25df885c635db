package io.clusterreconciler.artifacts;

import io.clusterreconciler.models.ArtifactChange;
import io.clusterreconciler.models.ArtifactPlan;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;

import static io.clusterreconciler.config.Constants.*;

/**
 * Artifact tree on disk:
 * <pre>
 *   &lt;root&gt;/hosts/&lt;node&gt;.nix
 *   &lt;root&gt;/deploy-nodes.json
 * </pre>
 * A batch is written into a staging copy of the tree which then replaces the live tree by
 * directory rename. Reads never modify the tree; a crash mid-swap is repaired by the next
 * {@link #apply(ArtifactPlan)}.
 */
@Slf4j
public class FileSystemArtifactStore implements ArtifactStore {
    
    private final Path root;
    private final Path staging;
    private final Path previous;
    
    public FileSystemArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        this.staging = this.root.resolveSibling("." + this.root.getFileName() + STAGING_SUFFIX);
        this.previous = this.root.resolveSibling("." + this.root.getFileName() + PREVIOUS_SUFFIX);
    }
    
    @Override
    public SortedSet<String> listArtifactKeys() throws IOException {
        SortedSet<String> keys = new TreeSet<>();
        Path hosts = liveTree().resolve(PATH_HOSTS);
        if (!Files.isDirectory(hosts)) {
            return keys;
        }
        try (Stream<Path> files = Files.list(hosts)) {
            files.filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(ARTIFACT_SUFFIX) && !name.startsWith("."))
                    .map(name -> name.substring(0, name.length() - ARTIFACT_SUFFIX.length()))
                    .forEach(keys::add);
        }
        return keys;
    }
    
    @Override
    public Optional<String> readArtifact(String key) throws IOException {
        return readIfExists(artifactPath(liveTree(), key));
    }
    
    @Override
    public Optional<String> readDescriptor() throws IOException {
        return readIfExists(liveTree().resolve(DESCRIPTOR_FILE));
    }
    
    @Override
    public void apply(ArtifactPlan plan) {
        try {
            recover();
        } catch (IOException e) {
            throw new ArtifactWriteException("Failed to recover artifact tree at " + root + ": " + e.getMessage(), e);
        }
        
        stage(plan);
        swap();
        log.info("Committed artifact batch to {}", root);
    }
    
    @Override
    public String describe() {
        return root.toString();
    }
    
    /**
     * Tree holding the committed artifacts: the live root, or the tree moved aside by an
     * interrupted swap when the root is missing.
     */
    private Path liveTree() {
        return !Files.exists(root) && Files.exists(previous) ? previous : root;
    }
    
    /**
     * Repair leftovers of an interrupted batch. A complete staging tree is never promoted:
     * the batch that produced it is simply re-run.
     */
    void recover() throws IOException {
        if (!Files.exists(root) && Files.exists(previous)) {
            log.warn("Restoring artifact tree from interrupted swap: {}", previous);
            Files.move(previous, root, StandardCopyOption.ATOMIC_MOVE);
        } else if (Files.exists(previous)) {
            log.info("Removing previous artifact tree left by a completed swap: {}", previous);
            deleteRecursively(previous);
        }
        if (Files.exists(staging)) {
            log.warn("Discarding staging tree of an interrupted batch: {}", staging);
            deleteRecursively(staging);
        }
    }
    
    private void stage(ArtifactPlan plan) {
        try {
            if (Files.exists(root)) {
                copyRecursively(root, staging);
            } else {
                Files.createDirectories(staging);
            }
            Files.createDirectories(staging.resolve(PATH_HOSTS));
            
            for (ArtifactChange change : plan.getArtifacts()) {
                Path target = artifactPath(staging, change.getKey());
                switch (change.getAction()) {
                    case CREATE, UPDATE -> writeFile(target, change.getContent());
                    case DELETE -> Files.deleteIfExists(target);
                    case UNCHANGED -> { }
                }
            }
            ArtifactChange descriptor = plan.getDescriptor();
            if (descriptor.getAction().isChange()) {
                writeFile(staging.resolve(DESCRIPTOR_FILE), descriptor.getContent());
            }
        } catch (IOException e) {
            discardStaging();
            throw new ArtifactWriteException("Failed to stage artifact batch: " + e.getMessage(), e);
        }
    }
    
    private void swap() {
        boolean hadRoot = Files.exists(root);
        try {
            if (hadRoot) {
                Files.move(root, previous, StandardCopyOption.ATOMIC_MOVE);
            }
            Files.move(staging, root, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            if (hadRoot && !Files.exists(root) && Files.exists(previous)) {
                try {
                    Files.move(previous, root, StandardCopyOption.ATOMIC_MOVE);
                } catch (IOException restoreError) {
                    log.error("Failed to restore artifact tree from {}; it will be restored on the next run",
                            previous, restoreError);
                }
            }
            discardStaging();
            throw new ArtifactWriteException("Failed to swap in artifact batch: " + e.getMessage(), e);
        }
        
        try {
            deleteRecursively(previous);
        } catch (IOException e) {
            log.warn("Failed to remove previous artifact tree {}: {}", previous, e.getMessage());
        }
    }
    
    /**
     * Write one staged file. Separate so that tests can inject a failure.
     */
    protected void writeFile(Path target, String content) throws IOException {
        Files.writeString(target, content, StandardCharsets.UTF_8);
    }
    
    private void discardStaging() {
        try {
            deleteRecursively(staging);
        } catch (IOException e) {
            log.warn("Failed to remove staging tree {}: {}", staging, e.getMessage());
        }
    }
    
    private static Path artifactPath(Path base, String key) {
        return base.resolve(PATH_HOSTS).resolve(key + ARTIFACT_SUFFIX);
    }
    
    private static Optional<String> readIfExists(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
    }
    
    private static void copyRecursively(Path source, Path target) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir)));
                return FileVisitResult.CONTINUE;
            }
            
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, target.resolve(source.relativize(file)), StandardCopyOption.COPY_ATTRIBUTES);
                return FileVisitResult.CONTINUE;
            }
        });
    }
    
    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }
            
            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
