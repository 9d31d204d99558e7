package org.commissaire.http.pojos;

import lombok.Data;

import java.util.Map;

/**
 * Status report for a single host.
 */
@Data
public class HostStatus {

    public static final String TYPE_HOST_ONLY = "host_only";

    private Map<String, Object> host;
    private String type = TYPE_HOST_ONLY;
    private Map<String, Object> container = Map.of();

    public static HostStatus of(Host host) {
        HostStatus status = new HostStatus();
        status.setHost(Map.of(
                "last_check", host.getLastCheck() == null ? "" : host.getLastCheck(),
                "status", host.getStatus() == null ? "" : host.getStatus()));
        return status;
    }
}
