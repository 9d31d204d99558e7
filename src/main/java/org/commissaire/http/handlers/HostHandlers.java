package org.commissaire.http.handlers;

import org.commissaire.http.pojos.CallEnvelope;
import org.commissaire.http.pojos.CallResult;
import org.commissaire.http.pojos.Host;
import org.commissaire.http.pojos.HostStatus;
import org.commissaire.http.pojos.ModelValidationException;
import org.commissaire.http.pojos.Models;
import org.commissaire.http.pojos.RpcErrorCode;
import org.commissaire.http.rest.HandlerCollection;
import org.commissaire.http.rest.HandlerTable;
import org.commissaire.http.services.LoggingService;
import org.commissaire.http.services.RemoteCallClient;
import org.commissaire.http.services.RemoteCallException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.commissaire.http.handlers.HandlerSupport.createResponse;
import static org.commissaire.http.handlers.HandlerSupport.returnError;

/**
 * Handlers for hosts. Credentials are only returned by {@code getHostCreds}.
 */
public class HostHandlers implements HandlerCollection {

    public static final String NAME = "hosts";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void describe(HandlerTable table) {
        table.function("listHosts", this::listHosts)
                .function("getHost", this::getHost)
                .function("createHost", this::createHost)
                .function("deleteHost", this::deleteHost)
                .function("getHostCreds", this::getHostCreds)
                .function("getHostStatus", this::getHostStatus);
    }

    CallResult listHosts(CallEnvelope envelope, RemoteCallClient client) throws RemoteCallException {
        return createResponse(envelope.getId(), new StorageCalls(client).list("Hosts"));
    }

    CallResult getHost(CallEnvelope envelope, RemoteCallClient client) {
        String address = envelope.getStringParam("address");
        try {
            return createResponse(envelope.getId(), new StorageCalls(client).get("Host", Map.of("address", address)));
        } catch (RemoteCallException e) {
            LoggingService.debug("host_not_found", LoggingService.data("host", address));
            return returnError(envelope, e, RpcErrorCode.NOT_FOUND);
        }
    }

    /**
     * Creates a host, or returns the stored one when it already exists with the
     * same key. A {@code cluster} param names the cluster the host joins.
     */
    CallResult createHost(CallEnvelope envelope, RemoteCallClient client) throws RemoteCallException {
        LoggingService.debug("host_create_requested", LoggingService.data("params", envelope.getParams().keySet()));
        String address = envelope.getStringParam("address");
        if (address == null) {
            return returnError(envelope, "\"address\" must be given in the url or in the PUT body",
                    RpcErrorCode.INVALID_PARAMETERS);
        }
        StorageCalls storage = new StorageCalls(client);
        String clusterName = envelope.getStringParam("cluster");
        boolean joinsCluster = clusterName != null && !clusterName.isEmpty();

        Map<String, Object> existing = null;
        try {
            existing = storage.get("Host", Map.of("address", address), true);
        } catch (RemoteCallException e) {
            LoggingService.debug("host_creating", LoggingService.data("host", address));
        }

        if (existing != null) {
            LoggingService.debug("host_already_exists", LoggingService.data("host", address));
            String requestedKey = Objects.toString(envelope.getParams().get("ssh_priv_key"), "");
            if (!requestedKey.equals(Objects.toString(existing.get("ssh_priv_key"), ""))) {
                return returnError(envelope, "Host already exists", RpcErrorCode.CONFLICT);
            }
            if (joinsCluster) {
                Map<String, Object> cluster = findCluster(storage, clusterName);
                if (cluster == null) {
                    return returnError(envelope, "Cluster does not exist", RpcErrorCode.INVALID_PARAMETERS);
                }
                if (!hostset(cluster).contains(address)) {
                    LoggingService.debug("host_not_in_cluster", LoggingService.data(
                            "host", address, "cluster", clusterName));
                    return returnError(envelope, "Host not in cluster", RpcErrorCode.CONFLICT);
                }
            }
            return createResponse(envelope.getId(), Models.fromMap(existing, Host.class).toSafeMap());
        }

        if (joinsCluster) {
            Map<String, Object> cluster = findCluster(storage, clusterName);
            if (cluster == null) {
                LoggingService.warn("host_create_cluster_missing", LoggingService.data(
                        "host", address, "cluster", clusterName));
                return returnError(envelope, "Cluster does not exist", RpcErrorCode.INVALID_PARAMETERS);
            }
            List<Object> hostset = hostset(cluster);
            if (!hostset.contains(address)) {
                hostset.add(address);
                cluster.put("hostset", hostset);
                storage.save("Cluster", cluster);
            }
        }

        Host host = Models.fromMap(envelope.getParams(), Host.class);
        try {
            host.validate();
        } catch (ModelValidationException e) {
            return returnError(envelope, e, RpcErrorCode.INVALID_REQUEST);
        }
        storage.save("Host", host.toSecureMap());
        return createResponse(envelope.getId(), host.toSafeMap());
    }

    /**
     * Deletes the host and drops it from the cluster it belonged to.
     */
    CallResult deleteHost(CallEnvelope envelope, RemoteCallClient client) {
        String address = envelope.getStringParam("address");
        StorageCalls storage = new StorageCalls(client);
        try {
            LoggingService.debug("host_deleting", LoggingService.data("host", address));
            storage.delete("Host", Map.of("address", address));
            for (Object entry : storage.list("Clusters", true)) {
                if (!(entry instanceof Map)) continue;
                Map<String, Object> cluster = new LinkedHashMap<>(castMap(entry));
                List<Object> hostset = hostset(cluster);
                if (hostset.remove(address)) {
                    LoggingService.info("host_removed_from_cluster", LoggingService.data(
                            "host", address, "cluster", cluster.get("name")));
                    cluster.put("hostset", hostset);
                    storage.save("Cluster", cluster);
                    // A host belongs to at most one cluster.
                    break;
                }
            }
            return createResponse(envelope.getId(), List.of());
        } catch (RemoteCallException e) {
            LoggingService.debug("host_delete_failed", LoggingService.data("host", address, "error", e.getMessage()));
            return returnError(envelope, e, RpcErrorCode.NOT_FOUND);
        } catch (RuntimeException e) {
            LoggingService.debug("host_delete_failed", LoggingService.data("host", address, "error", e.toString()));
            return returnError(envelope, e, RpcErrorCode.INTERNAL_ERROR);
        }
    }

    CallResult getHostCreds(CallEnvelope envelope, RemoteCallClient client) {
        String address = envelope.getStringParam("address");
        try {
            Host host = Models.fromMap(new StorageCalls(client).get("Host", Map.of("address", address), true), Host.class);
            Map<String, Object> creds = new LinkedHashMap<>();
            creds.put("remote_user", host.getRemoteUser());
            creds.put("ssh_priv_key", host.getSshPrivKey());
            return createResponse(envelope.getId(), creds);
        } catch (RemoteCallException e) {
            LoggingService.debug("host_not_found", LoggingService.data("host", address));
            return returnError(envelope, e, RpcErrorCode.NOT_FOUND);
        }
    }

    CallResult getHostStatus(CallEnvelope envelope, RemoteCallClient client) {
        String address = envelope.getStringParam("address");
        try {
            Host host = Models.fromMap(new StorageCalls(client).get("Host", Map.of("address", address)), Host.class);
            HostStatus status = HostStatus.of(host);
            LoggingService.debug("host_status", LoggingService.data("host", address, "status", status.getHost()));
            return createResponse(envelope.getId(), Models.toMap(status));
        } catch (RemoteCallException e) {
            LoggingService.warn("host_status_unavailable", LoggingService.data("host", address, "error", e.getMessage()));
            return returnError(envelope, e, RpcErrorCode.NOT_FOUND);
        } catch (RuntimeException e) {
            LoggingService.debug("host_status_failed", LoggingService.data("host", address, "error", e.toString()));
            return returnError(envelope, e, RpcErrorCode.INTERNAL_ERROR);
        }
    }

    // ============= Private Helpers =============

    private static Map<String, Object> findCluster(StorageCalls storage, String name) {
        try {
            return new LinkedHashMap<>(storage.get("Cluster", Map.of("name", name), true));
        } catch (RemoteCallException e) {
            LoggingService.warn("cluster_lookup_failed", LoggingService.data("cluster", name, "error", e.getMessage()));
            return null;
        }
    }

    private static List<Object> hostset(Map<String, Object> cluster) {
        Object hostset = cluster.get("hostset");
        return hostset instanceof List ? new ArrayList<>((List<?>) hostset) : new ArrayList<>();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object entry) {
        return (Map<String, Object>) entry;
    }
}
