package io.clusterreconciler.desiredstate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusterreconciler.models.ClusterSpec;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Parses the topology document into a validated cluster spec.
 */
@Slf4j
public class DesiredStateLoader {
    
    private final ObjectMapper objectMapper;
    private final DesiredStateValidator validator;
    
    public DesiredStateLoader(DesiredStateValidator validator) {
        this.validator = validator;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
    
    /**
     * Load and validate the topology document.
     *
     * @param topologyFile path of the JSON topology document
     * @return the validated spec
     * @throws ValidationException carrying every violation when the document is unreadable or invalid
     */
    public ClusterSpec load(Path topologyFile) {
        log.info("Loading desired state from {}", topologyFile);
        
        String json;
        try {
            json = Files.readString(topologyFile);
        } catch (NoSuchFileException e) {
            throw new ValidationException("Topology file not found: " + topologyFile, e);
        } catch (IOException e) {
            throw new ValidationException("Failed to read topology file " + topologyFile + ": " + e.getMessage(), e);
        }
        return parse(json);
    }
    
    public ClusterSpec parse(String json) {
        ClusterSpec spec;
        try {
            spec = objectMapper.readValue(json, ClusterSpec.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Failed to parse topology document: " + e.getOriginalMessage(), e);
        }
        if (spec == null) {
            throw new ValidationException("Topology document is empty", null);
        }
        
        List<ValidationViolation> violations = validator.validate(spec);
        if (!violations.isEmpty()) {
            violations.forEach(violation -> log.error("Validation - {}", violation));
            throw new ValidationException(violations);
        }
        
        log.info("Loaded desired state: domain={}, subnet={}, {} node(s)",
                spec.getDomain(), spec.getSubnet(), spec.getNodes().size());
        return spec;
    }
}
