package org.commissaire.http.handlers;

import org.commissaire.http.pojos.CallEnvelope;
import org.commissaire.http.pojos.CallResult;
import org.commissaire.http.pojos.Cluster;
import org.commissaire.http.pojos.Host;
import org.commissaire.http.pojos.ModelValidationException;
import org.commissaire.http.pojos.Models;
import org.commissaire.http.pojos.RpcErrorCode;
import org.commissaire.http.rest.HandlerCollection;
import org.commissaire.http.rest.HandlerTable;
import org.commissaire.http.services.LoggingService;
import org.commissaire.http.services.RemoteCallClient;
import org.commissaire.http.services.RemoteCallException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.commissaire.http.handlers.HandlerSupport.createResponse;
import static org.commissaire.http.handlers.HandlerSupport.returnError;

/**
 * Handlers for clusters and their member hosts.
 */
public class ClusterHandlers implements HandlerCollection {

    public static final String NAME = "clusters";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void describe(HandlerTable table) {
        table.function("listClusters", this::listClusters)
                .function("getCluster", this::getCluster)
                .function("createCluster", this::createCluster)
                .function("deleteCluster", this::deleteCluster)
                .function("listClusterMembers", this::listClusterMembers)
                .function("updateClusterMembers", this::updateClusterMembers)
                .function("checkClusterMember", this::checkClusterMember)
                .function("addClusterMember", this::addClusterMember)
                .function("deleteClusterMember", this::deleteClusterMember);
    }

    CallResult listClusters(CallEnvelope envelope, RemoteCallClient client) throws RemoteCallException {
        List<String> names = new ArrayList<>();
        for (Object entry : new StorageCalls(client).list("Clusters")) {
            if (entry instanceof Map) {
                names.add(String.valueOf(((Map<?, ?>) entry).get("name")));
            }
        }
        return createResponse(envelope.getId(), names);
    }

    /**
     * The cluster with host availability counters. Status is degraded while any
     * member is not active and failed once none are.
     */
    CallResult getCluster(CallEnvelope envelope, RemoteCallClient client) {
        StorageCalls storage = new StorageCalls(client);
        String name = envelope.getStringParam("name");
        Cluster cluster;
        try {
            cluster = fetchCluster(storage, name);
        } catch (RemoteCallException e) {
            LoggingService.debug("cluster_not_found", LoggingService.data("cluster", name));
            return returnError(envelope, e, RpcErrorCode.NOT_FOUND);
        }

        int total = 0;
        int available = 0;
        int unavailable = 0;
        cluster.setStatus(Cluster.STATUS_OK);
        for (String address : cluster.getHostset()) {
            total++;
            if (isActive(storage, address)) {
                available++;
            } else {
                unavailable++;
                cluster.setStatus(Cluster.STATUS_DEGRADED);
            }
        }
        if (total > 0 && total == unavailable) {
            cluster.setStatus(Cluster.STATUS_FAILED);
        }
        return createResponse(envelope.getId(), cluster.toMapWithHosts(total, available, unavailable));
    }

    /**
     * Saves the cluster described by the params. A network that does not exist is
     * replaced by the default network.
     */
    CallResult createCluster(CallEnvelope envelope, RemoteCallClient client) throws RemoteCallException {
        StorageCalls storage = new StorageCalls(client);
        Map<String, Object> params = new LinkedHashMap<>(envelope.getParams());
        String name = envelope.getStringParam("name");
        try {
            fetchCluster(storage, name);
            LoggingService.debug("cluster_already_exists", LoggingService.data("cluster", name));
        } catch (RemoteCallException e) {
            LoggingService.debug("cluster_creating", LoggingService.data("cluster", name));
            Object network = params.get("network");
            if (network != null && !String.valueOf(network).isEmpty()) {
                try {
                    storage.get("Network", Map.of("name", String.valueOf(network)));
                } catch (RemoteCallException missing) {
                    LoggingService.debug("cluster_network_defaulted", LoggingService.data(
                            "cluster", name, "network", network));
                    params.put("network", Cluster.DEFAULT_NETWORK);
                }
            }
        }

        Cluster cluster = Models.fromMap(params, Cluster.class);
        try {
            cluster.validate();
        } catch (ModelValidationException e) {
            return returnError(envelope, e, RpcErrorCode.INVALID_REQUEST);
        }
        Map<String, Object> saved = storage.save("Cluster", Models.toMap(cluster));
        return createResponse(envelope.getId(), Models.fromMap(saved, Cluster.class).toSafeMap());
    }

    CallResult deleteCluster(CallEnvelope envelope, RemoteCallClient client) {
        String name = envelope.getStringParam("name");
        try {
            LoggingService.debug("cluster_deleting", LoggingService.data("cluster", name));
            new StorageCalls(client).delete("Cluster", Map.of("name", name));
            return createResponse(envelope.getId(), List.of());
        } catch (RemoteCallException e) {
            return returnError(envelope, e, RpcErrorCode.NOT_FOUND);
        } catch (RuntimeException e) {
            LoggingService.debug("cluster_delete_failed", LoggingService.data(
                    "cluster", name, "error", e.toString()));
            return returnError(envelope, e, RpcErrorCode.INTERNAL_ERROR);
        }
    }

    CallResult listClusterMembers(CallEnvelope envelope, RemoteCallClient client) {
        try {
            Cluster cluster = fetchCluster(new StorageCalls(client), envelope.getStringParam("name"));
            return createResponse(envelope.getId(), cluster.getHostset());
        } catch (RemoteCallException e) {
            return returnError(envelope, e, RpcErrorCode.NOT_FOUND);
        }
    }

    /**
     * Replaces the member list. The caller's {@code old} set must equal the stored
     * one, otherwise someone else changed the cluster in between.
     */
    CallResult updateClusterMembers(CallEnvelope envelope, RemoteCallClient client) throws RemoteCallException {
        Object oldParam = envelope.getParams().get("old");
        Object newParam = envelope.getParams().get("new");
        if (!(oldParam instanceof Collection) || !(newParam instanceof Collection)) {
            return returnError(envelope, "\"old\" and \"new\" host lists are required", RpcErrorCode.BAD_REQUEST);
        }
        Set<String> oldHosts = toStringSet((Collection<?>) oldParam);
        Set<String> newHosts = toStringSet((Collection<?>) newParam);

        StorageCalls storage = new StorageCalls(client);
        String name = envelope.getStringParam("name");
        Cluster cluster;
        try {
            cluster = fetchCluster(storage, name);
        } catch (RemoteCallException e) {
            return returnError(envelope, e, RpcErrorCode.NOT_FOUND);
        }

        if (!oldHosts.equals(new LinkedHashSet<>(cluster.getHostset()))) {
            String message = "Conflict setting hosts for cluster " + name;
            LoggingService.warn("cluster_members_conflict", LoggingService.data(
                    "cluster", name, "expected", oldHosts, "stored", cluster.getHostset()));
            return returnError(envelope, message, RpcErrorCode.CONFLICT);
        }

        // TODO: verify each new host exists and is not a member of another cluster
        cluster.setHostset(new ArrayList<>(newHosts));
        Map<String, Object> saved = storage.save("Cluster", Models.toMap(cluster));
        return createResponse(envelope.getId(), Models.toMap(Models.fromMap(saved, Cluster.class)));
    }

    CallResult checkClusterMember(CallEnvelope envelope, RemoteCallClient client) {
        String host = envelope.getStringParam("host");
        try {
            Cluster cluster = fetchCluster(new StorageCalls(client), envelope.getStringParam("name"));
            if (cluster.getHostset().contains(host)) {
                return createResponse(envelope.getId(), List.of(host));
            }
            return returnError(envelope, "The requested host is not part of the cluster.", RpcErrorCode.NOT_FOUND);
        } catch (RemoteCallException e) {
            return returnError(envelope, e, RpcErrorCode.INTERNAL_ERROR);
        }
    }

    CallResult addClusterMember(CallEnvelope envelope, RemoteCallClient client) {
        String host = envelope.getStringParam("host");
        StorageCalls storage = new StorageCalls(client);
        try {
            Cluster cluster = fetchCluster(storage, envelope.getStringParam("name"));
            if (!cluster.getHostset().contains(host)) {
                cluster.getHostset().add(host);
                storage.save("Cluster", Models.toMap(cluster));
            }
            return createResponse(envelope.getId(), List.of(host));
        } catch (RemoteCallException e) {
            return returnError(envelope, e, RpcErrorCode.INTERNAL_ERROR);
        }
    }

    CallResult deleteClusterMember(CallEnvelope envelope, RemoteCallClient client) {
        String host = envelope.getStringParam("host");
        StorageCalls storage = new StorageCalls(client);
        try {
            Cluster cluster = fetchCluster(storage, envelope.getStringParam("name"));
            if (cluster.getHostset().remove(host)) {
                storage.save("Cluster", Models.toMap(cluster));
            }
            return createResponse(envelope.getId(), List.of());
        } catch (RemoteCallException e) {
            return returnError(envelope, e, RpcErrorCode.NOT_FOUND);
        }
    }

    // ============= Private Helpers =============

    private static Cluster fetchCluster(StorageCalls storage, String name) throws RemoteCallException {
        Cluster cluster = Models.fromMap(storage.get("Cluster", Map.of("name", name), true), Cluster.class);
        if (cluster.getHostset() == null) {
            cluster.setHostset(new ArrayList<>());
        }
        return cluster;
    }

    private static boolean isActive(StorageCalls storage, String address) {
        try {
            Host host = Models.fromMap(storage.get("Host", Map.of("address", address)), Host.class);
            return Host.STATUS_ACTIVE.equals(host.getStatus());
        } catch (RemoteCallException e) {
            LoggingService.debug("cluster_member_lookup_failed", LoggingService.data(
                    "host", address, "error", e.getMessage()));
            return false;
        }
    }

    private static Set<String> toStringSet(Collection<?> values) {
        Set<String> set = new LinkedHashSet<>();
        for (Object value : values) {
            set.add(String.valueOf(value));
        }
        return set;
    }
}
