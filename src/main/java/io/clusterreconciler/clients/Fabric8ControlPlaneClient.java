package io.clusterreconciler.clients;

import io.clusterreconciler.models.ClusterMember;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeAddress;
import io.fabric8.kubernetes.api.model.NodeBuilder;
import io.fabric8.kubernetes.api.model.NodeCondition;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static io.clusterreconciler.config.Constants.*;

/**
 * {@link ControlPlaneClient} on the fabric8 Kubernetes client.
 * Drain mirrors {@code kubectl drain --ignore-daemonsets --delete-emptydir-data --force}.
 */
@Slf4j
public class Fabric8ControlPlaneClient implements ControlPlaneClient {
    
    private static final String POD_NODE_FIELD = "spec.nodeName";
    private static final String PHASE_SUCCEEDED = "Succeeded";
    private static final String PHASE_FAILED = "Failed";
    
    private final KubernetesClient client;
    private final long pollIntervalMillis;
    
    public Fabric8ControlPlaneClient(KubernetesClient client) {
        this(client, DRAIN_POLL_INTERVAL_MILLIS);
    }
    
    public Fabric8ControlPlaneClient(KubernetesClient client, long pollIntervalMillis) {
        this.client = client;
        this.pollIntervalMillis = pollIntervalMillis;
    }
    
    @Override
    public List<ClusterMember> listMembers() {
        List<Node> nodes = call("list nodes", () -> client.nodes().list().getItems());
        return nodes.stream().map(Fabric8ControlPlaneClient::toMember).collect(Collectors.toList());
    }
    
    @Override
    public Optional<ClusterMember> getMember(String name) {
        Node node = call("get node " + name, () -> client.nodes().withName(name).get());
        return Optional.ofNullable(node).map(Fabric8ControlPlaneClient::toMember);
    }
    
    @Override
    public int countEvictablePods(String name) {
        return evictablePods(name).size();
    }
    
    @Override
    public void cordon(String name) {
        call("cordon " + name, () -> client.nodes().withName(name).edit(node -> new NodeBuilder(node)
                .editOrNewSpec()
                .withUnschedulable(true)
                .endSpec()
                .build()));
        log.info("Cordoned {}", name);
    }
    
    @Override
    public DrainOutcome drain(String name, Duration timeout) {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        List<Pod> remaining = evictablePods(name);
        log.info("Draining {}: {} evictable pod(s)", name, remaining.size());
        
        while (!remaining.isEmpty() && System.currentTimeMillis() < deadline) {
            for (Pod pod : remaining) {
                evict(pod);
            }
            sleep();
            remaining = evictablePods(name);
        }
        
        if (remaining.isEmpty()) {
            log.info("Drained {}", name);
            return DrainOutcome.COMPLETED;
        }
        
        log.warn("Drain of {} did not finish within {}s, force deleting {} pod(s)",
                name, timeout.toSeconds(), remaining.size());
        for (Pod pod : remaining) {
            String namespace = pod.getMetadata().getNamespace();
            String podName = pod.getMetadata().getName();
            call("force delete pod " + namespace + "/" + podName,
                    () -> client.pods().inNamespace(namespace).withName(podName).withGracePeriod(0).delete());
        }
        return DrainOutcome.TIMED_OUT_FORCED;
    }
    
    @Override
    public boolean deleteMember(String name) {
        boolean deleted = !call("delete node " + name, () -> client.nodes().withName(name).delete()).isEmpty();
        if (deleted) {
            log.info("Deleted member {}", name);
        } else {
            log.info("Member {} already absent", name);
        }
        return deleted;
    }
    
    private List<Pod> evictablePods(String name) {
        List<Pod> pods = call("list pods on " + name, () -> client.pods()
                .inAnyNamespace()
                .withField(POD_NODE_FIELD, name)
                .list()
                .getItems());
        return pods.stream()
                .filter(pod -> name.equals(pod.getSpec() == null ? null : pod.getSpec().getNodeName()))
                .filter(Fabric8ControlPlaneClient::isEvictable)
                .collect(Collectors.toList());
    }
    
    private void evict(Pod pod) {
        String namespace = pod.getMetadata().getNamespace();
        String podName = pod.getMetadata().getName();
        boolean accepted = call("evict pod " + namespace + "/" + podName,
                () -> client.pods().inNamespace(namespace).withName(podName).evict());
        if (!accepted) {
            // blocked by a disruption budget, retried on the next poll
            log.debug("Eviction of {}/{} not accepted yet", namespace, podName);
        }
    }
    
    static boolean isEvictable(Pod pod) {
        String phase = pod.getStatus() == null ? null : pod.getStatus().getPhase();
        if (PHASE_SUCCEEDED.equals(phase) || PHASE_FAILED.equals(phase)) {
            return false;
        }
        Map<String, String> annotations = pod.getMetadata().getAnnotations();
        if (annotations != null && annotations.containsKey(ANNOTATION_MIRROR_POD)) {
            return false;
        }
        List<OwnerReference> owners = pod.getMetadata().getOwnerReferences();
        return owners == null || owners.stream().noneMatch(owner -> OWNER_KIND_DAEMON_SET.equals(owner.getKind()));
    }
    
    static ClusterMember toMember(Node node) {
        Map<String, String> labels = node.getMetadata().getLabels();
        boolean server = labels != null
                && (labels.containsKey(LABEL_CONTROL_PLANE) || labels.containsKey(LABEL_MASTER));
        boolean unschedulable = node.getSpec() != null && Boolean.TRUE.equals(node.getSpec().getUnschedulable());
        
        boolean ready = false;
        String address = null;
        if (node.getStatus() != null) {
            List<NodeCondition> conditions = node.getStatus().getConditions();
            if (conditions != null) {
                ready = conditions.stream()
                        .anyMatch(c -> CONDITION_READY.equals(c.getType()) && "True".equals(c.getStatus()));
            }
            List<NodeAddress> addresses = node.getStatus().getAddresses();
            if (addresses != null) {
                address = addresses.stream()
                        .filter(a -> ADDRESS_INTERNAL_IP.equals(a.getType()))
                        .map(NodeAddress::getAddress)
                        .findFirst()
                        .orElse(null);
            }
        }
        
        return ClusterMember.builder()
                .name(node.getMetadata().getName())
                .ready(ready)
                .schedulable(!unschedulable)
                .server(server)
                .address(address)
                .build();
    }
    
    private static <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (KubernetesClientException e) {
            throw new ConnectivityException("Control plane request failed (" + operation + "): " + e.getMessage(), e);
        }
    }
    
    private void sleep() {
        try {
            Thread.sleep(pollIntervalMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectivityException("Interrupted while draining", e);
        }
    }
}
