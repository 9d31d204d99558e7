package org.commissaire.http.handlers;

import org.commissaire.http.rest.HandlerRef;
import org.commissaire.http.rest.ResponseConverter;
import org.commissaire.http.rest.RouteTable;

import java.util.Map;
import java.util.Set;

/**
 * The v0 API. Every route points at a registry name, so a collection left out
 * of the configuration turns its routes into 404s.
 */
public final class Routes {

    private static final Map<String, String> NAME = Map.of("name", RoutingPatterns.NAME);
    private static final Map<String, String> NAME_AND_HOST = Map.of(
            "name", RoutingPatterns.NAME,
            "host", RoutingPatterns.ADDRESS);
    private static final Map<String, String> ADDRESS = Map.of("address", RoutingPatterns.ADDRESS);

    private Routes() {}

    public static RouteTable register(RouteTable table) {
        registerClusters(table);
        registerClusterOperations(table);
        registerHosts(table);
        registerNetworks(table);
        return table;
    }

    private static void registerClusters(RouteTable table) {
        table.get("/api/v0/clusters/", Map.of(), clusters("listClusters"));
        table.get("/api/v0/cluster/{name}/", NAME, clusters("getCluster"));
        table.put("/api/v0/cluster/{name}/", NAME, clusters("createCluster"));
        table.delete("/api/v0/cluster/{name}/", NAME, clusters("deleteCluster"));

        table.get("/api/v0/cluster/{name}/hosts/", NAME, clusters("listClusterMembers"));
        table.register("/api/v0/cluster/{name}/hosts/", Set.of("PUT"), NAME,
                clusters("updateClusterMembers"), ResponseConverter.ACTION_ADD);

        table.get("/api/v0/cluster/{name}/hosts/{host}/", NAME_AND_HOST, clusters("checkClusterMember"));
        table.register("/api/v0/cluster/{name}/hosts/{host}/", Set.of("PUT"), NAME_AND_HOST,
                clusters("addClusterMember"), ResponseConverter.ACTION_ADD);
        table.delete("/api/v0/cluster/{name}/hosts/{host}/", NAME_AND_HOST, clusters("deleteClusterMember"));
    }

    private static void registerClusterOperations(RouteTable table) {
        table.get("/api/v0/cluster/{name}/deploy", NAME, ref(ClusterDeployHandlers.NAME, "getClusterDeploy"));
        table.put("/api/v0/cluster/{name}/deploy", NAME, ref(ClusterDeployHandlers.NAME, "createClusterDeploy"));
    }

    private static void registerHosts(RouteTable table) {
        table.get("/api/v0/hosts/", Map.of(), hosts("listHosts"));
        table.put("/api/v0/host/", Map.of(), hosts("createHost"));
        table.get("/api/v0/host/{address}/", ADDRESS, hosts("getHost"));
        table.put("/api/v0/host/{address}/", ADDRESS, hosts("createHost"));
        table.delete("/api/v0/host/{address}/", ADDRESS, hosts("deleteHost"));
        table.get("/api/v0/host/{address}/creds", ADDRESS, hosts("getHostCreds"));
        table.get("/api/v0/host/{address}/status/", ADDRESS, hosts("getHostStatus"));
    }

    private static void registerNetworks(RouteTable table) {
        table.get("/api/v0/networks/", Map.of(), ref(NetworkHandlers.NAME, "listNetworks"));
        table.get("/api/v0/network/{name}/", NAME, ref(NetworkHandlers.NAME, "getNetwork"));
        table.put("/api/v0/network/{name}/", NAME, ref(NetworkHandlers.NAME, "createNetwork"));
        table.delete("/api/v0/network/{name}/", NAME, ref(NetworkHandlers.NAME, "deleteNetwork"));
    }

    private static HandlerRef clusters(String member) {
        return ref(ClusterHandlers.NAME, member);
    }

    private static HandlerRef hosts(String member) {
        return ref(HostHandlers.NAME, member);
    }

    private static HandlerRef ref(String collection, String member) {
        return HandlerRef.named(collection + "." + member);
    }
}
