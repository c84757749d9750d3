package com.mediafleet.manager.provisioning;

import com.mediafleet.core.error.MediaNodeException;
import com.mediafleet.core.error.ProvisioningFailureException;
import com.mediafleet.manager.config.ManagerConfig;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.PodStatus;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Provisions media nodes as Kubernetes pods, one pod per node.
 * <p>
 * Launch creates a pod named after the new node id from the configured image and
 * label. A watch on that label translates pod events into listener calls:
 * <ul>
 *   <li>pod Ready: {@code confirmAvailable}</li>
 *   <li>pod Failed before it was ever Ready: {@code abortLaunch} (and the pod is deleted)</li>
 *   <li>pod deleted: {@code confirmTerminated} if its termination was requested or it had
 *   become Ready, otherwise {@code abortLaunch}</li>
 * </ul>
 * </p>
 */
public class KubernetesProvisioningGateway implements IProvisioningGateway {
    private static final Logger log = LoggerFactory.getLogger(KubernetesProvisioningGateway.class);

    private static final String APP_LABEL = "app";
    private static final String MANAGED_BY_LABEL = "app.kubernetes.io/managed-by";
    private static final String CONTAINER_NAME = "media-node";
    private static final String ID_PREFIX = "media-node-";

    private final KubernetesClient client;
    private final String namespace;
    private final String image;
    private final String label;
    private final String managerId;

    // Pods already reported Ready; a pod that never got here was still launching
    private final Set<String> available = ConcurrentHashMap.newKeySet();
    // Pods this process asked to delete, including adopted ones it never saw become Ready
    private final Set<String> terminationRequested = ConcurrentHashMap.newKeySet();

    private volatile ProvisioningListener listener;
    private Watch watch;

    public KubernetesProvisioningGateway(ManagerConfig config) {
        this(new KubernetesClientBuilder().build(), config);
    }

    public KubernetesProvisioningGateway(KubernetesClient client, ManagerConfig config) {
        this.client = client;
        this.namespace = config.getKubernetesNamespace();
        this.image = config.getMediaNodeImage();
        this.label = config.getMediaNodeLabel();
        this.managerId = config.getNodeId();
        log.info("Kubernetes provisioning gateway initialized: namespace={}, image={}, label={}",
            namespace, image, label);
    }

    @Override
    public Mono<String> requestLaunch() {
        return Mono.fromCallable(() -> {
                String mediaNodeId = ID_PREFIX + UUID.randomUUID().toString().substring(0, 8);
                client.pods()
                    .inNamespace(namespace)
                    .resource(buildPod(mediaNodeId))
                    .create();
                log.info("Created pod for media node {} in namespace {}", mediaNodeId, namespace);
                return mediaNodeId;
            })
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(err -> !(err instanceof ProvisioningFailureException),
                err -> new ProvisioningFailureException(null, "Failed to create media node pod: " + err.getMessage(), err));
    }

    @Override
    public Mono<Void> requestTermination(String mediaNodeId) {
        terminationRequested.add(mediaNodeId);
        return Mono.fromCallable(() -> {
                List<StatusDetails> deleted = client.pods()
                    .inNamespace(namespace)
                    .withName(mediaNodeId)
                    .delete();
                return deleted.isEmpty();
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(alreadyGone -> {
                if (alreadyGone) {
                    // No DELETED event will follow for a pod that does not exist
                    terminationRequested.remove(mediaNodeId);
                    available.remove(mediaNodeId);
                    log.warn("Pod for media node {} not found, treating it as terminated", mediaNodeId);
                    notifyListener(mediaNodeId, l -> l.confirmTerminated(mediaNodeId));
                } else {
                    log.info("Deletion requested for pod of media node {}", mediaNodeId);
                }
            })
            .onErrorMap(err -> !(err instanceof ProvisioningFailureException),
                err -> new ProvisioningFailureException(mediaNodeId,
                    "Failed to delete pod of media node " + mediaNodeId + ": " + err.getMessage(), err))
            .then();
    }

    @Override
    public void subscribe(ProvisioningListener listener) {
        attach(listener);
        this.watch = client.pods()
            .inNamespace(namespace)
            .withLabel(APP_LABEL, label)
            .watch(new Watcher<Pod>() {
                @Override
                public void eventReceived(Action action, Pod pod) {
                    handlePodEvent(action, pod);
                }

                @Override
                public void onClose(WatcherException cause) {
                    log.error("Media node pod watch closed unexpectedly", cause);
                }
            });
        log.info("Watching media node pods with label {}={}", APP_LABEL, label);
    }

    /**
     * Routes pod events to {@code listener} without opening a watch.
     */
    void attach(ProvisioningListener listener) {
        this.listener = listener;
    }

    void handlePodEvent(Watcher.Action action, Pod pod) {
        String mediaNodeId = pod.getMetadata().getName();
        switch (action) {
            case ADDED:
            case MODIFIED:
                if (isPodFailed(pod)) {
                    if (!available.contains(mediaNodeId)) {
                        String reason = "pod failed: " + pod.getStatus().getReason();
                        notifyListener(mediaNodeId, l -> l.abortLaunch(mediaNodeId, reason));
                        deleteFailedPod(mediaNodeId);
                    } else {
                        log.warn("Pod of running media node {} failed", mediaNodeId);
                    }
                } else if (isPodReady(pod) && available.add(mediaNodeId)) {
                    notifyListener(mediaNodeId, l -> l.confirmAvailable(mediaNodeId));
                }
                break;
            case DELETED:
                boolean wasAvailable = available.remove(mediaNodeId);
                if (terminationRequested.remove(mediaNodeId) || wasAvailable) {
                    notifyListener(mediaNodeId, l -> l.confirmTerminated(mediaNodeId));
                } else {
                    notifyListener(mediaNodeId, l -> l.abortLaunch(mediaNodeId, "pod deleted before becoming ready"));
                }
                break;
            default:
                log.debug("Ignoring {} event for pod {}", action, mediaNodeId);
        }
    }

    static boolean isPodReady(Pod pod) {
        PodStatus status = pod.getStatus();
        return status != null
            && status.getConditions() != null
            && status.getConditions().stream()
                .anyMatch(c -> "Ready".equals(c.getType()) && "True".equals(c.getStatus()));
    }

    static boolean isPodFailed(Pod pod) {
        PodStatus status = pod.getStatus();
        return status != null && "Failed".equals(status.getPhase());
    }

    private Pod buildPod(String mediaNodeId) {
        return new PodBuilder()
            .withNewMetadata()
                .withName(mediaNodeId)
                .withNamespace(namespace)
                .addToLabels(APP_LABEL, label)
                .addToLabels(MANAGED_BY_LABEL, managerId)
            .endMetadata()
            .withNewSpec()
                .withRestartPolicy("Never")
                .addNewContainer()
                    .withName(CONTAINER_NAME)
                    .withImage(image)
                    .addNewEnv().withName("MEDIA_NODE_ID").withValue(mediaNodeId).endEnv()
                .endContainer()
            .endSpec()
            .build();
    }

    private void deleteFailedPod(String mediaNodeId) {
        Mono.fromRunnable(() -> client.pods().inNamespace(namespace).withName(mediaNodeId).delete())
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                v -> { },
                err -> log.warn("Failed to clean up failed pod of media node {}: {}", mediaNodeId, err.getMessage())
            );
    }

    private void notifyListener(String mediaNodeId, Consumer<ProvisioningListener> call) {
        ProvisioningListener current = listener;
        if (current == null) {
            log.warn("No provisioning listener registered, dropping event for media node {}", mediaNodeId);
            return;
        }
        try {
            call.accept(current);
        } catch (MediaNodeException e) {
            log.warn("Provisioning event for media node {} rejected: {}", mediaNodeId, e.getMessage());
        }
    }

    @Override
    public void close() {
        if (watch != null) {
            watch.close();
        }
        client.close();
        log.info("Kubernetes provisioning gateway closed");
    }
}
