package io.clusterreconciler.decommission;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static io.clusterreconciler.config.Constants.CREDENTIAL_DECOMMISSION_MARKER;

/**
 * Credential cache laid out as {@code <dir>/<node>/token} plus the optional
 * {@code <dir>/<node>/decommission-address} marker.
 */
@Slf4j
public class FileSystemCredentialStore implements CredentialStore {
    
    private final Path dir;
    
    public FileSystemCredentialStore(Path dir) {
        this.dir = dir;
    }
    
    @Override
    public void recordDecommission(String node, String address) throws IOException {
        Path entry = entry(node);
        Files.createDirectories(entry);
        Files.writeString(entry.resolve(CREDENTIAL_DECOMMISSION_MARKER), address == null ? "" : address,
                StandardCharsets.UTF_8);
        log.debug("Recorded decommission marker for {} ({})", node, address);
    }
    
    @Override
    public Optional<String> decommissionAddress(String node) throws IOException {
        Path marker = entry(node).resolve(CREDENTIAL_DECOMMISSION_MARKER);
        if (!Files.isRegularFile(marker)) {
            return Optional.empty();
        }
        String address = Files.readString(marker, StandardCharsets.UTF_8).trim();
        return address.isEmpty() ? Optional.empty() : Optional.of(address);
    }
    
    @Override
    public boolean clearDecommission(String node) throws IOException {
        boolean removed = Files.deleteIfExists(entry(node).resolve(CREDENTIAL_DECOMMISSION_MARKER));
        if (removed) {
            log.info("Cleared decommission marker of {}", node);
        }
        return removed;
    }
    
    @Override
    public SortedSet<String> nodesPendingDecommission() throws IOException {
        SortedSet<String> nodes = new TreeSet<>();
        if (!Files.isDirectory(dir)) {
            return nodes;
        }
        try (Stream<Path> entries = Files.list(dir)) {
            entries.filter(entry -> Files.isRegularFile(entry.resolve(CREDENTIAL_DECOMMISSION_MARKER)))
                    .map(entry -> entry.getFileName().toString())
                    .forEach(nodes::add);
        }
        return nodes;
    }
    
    @Override
    public boolean purge(String node) throws IOException {
        Path entry = entry(node);
        if (!Files.exists(entry)) {
            return false;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(entry)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
        log.info("Purged cached credentials of {}", node);
        return true;
    }
    
    private Path entry(String node) {
        Path entry = dir.resolve(node).normalize();
        if (!entry.getParent().equals(dir.normalize())) {
            throw new IllegalArgumentException("Invalid node name for credential cache: " + node);
        }
        return entry;
    }
}
