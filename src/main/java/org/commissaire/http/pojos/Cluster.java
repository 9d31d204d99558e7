package org.commissaire.http.pojos;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
public class Cluster {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_DEGRADED = "degraded";
    public static final String STATUS_FAILED = "failed";
    public static final String DEFAULT_NETWORK = "default";

    private static final Set<String> STATUSES = Set.of(STATUS_OK, STATUS_DEGRADED, STATUS_FAILED);

    private String name;
    private String status = STATUS_OK;
    private String network = DEFAULT_NETWORK;
    private List<String> hostset = new ArrayList<>();

    public void validate() throws ModelValidationException {
        if (name == null || name.isEmpty()) {
            throw new ModelValidationException("Cluster name must be a non-empty string");
        }
        if (!STATUSES.contains(status)) {
            throw new ModelValidationException("Cluster status must be one of " + STATUSES + ", got \"" + status + "\"");
        }
        if (network == null || network.isEmpty()) {
            throw new ModelValidationException("Cluster network must be a non-empty string");
        }
        if (hostset == null) {
            throw new ModelValidationException("Cluster hostset must be a list");
        }
    }

    /** Everything except the member list. */
    public Map<String, Object> toSafeMap() {
        Map<String, Object> data = Models.toMap(this);
        data.remove("hostset");
        return data;
    }

    /** The safe view plus host availability counters. */
    public Map<String, Object> toMapWithHosts(int total, int available, int unavailable) {
        Map<String, Object> hosts = new LinkedHashMap<>();
        hosts.put("total", total);
        hosts.put("available", available);
        hosts.put("unavailable", unavailable);
        Map<String, Object> data = toSafeMap();
        data.put("hosts", hosts);
        return data;
    }
}
