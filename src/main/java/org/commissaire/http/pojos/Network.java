package org.commissaire.http.pojos;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Data
public class Network {

    public static final String TYPE_FLANNEL_ETCD = "flannel_etcd";
    public static final String TYPE_FLANNEL_SERVER = "flannel_server";

    private static final Set<String> TYPES = Set.of(TYPE_FLANNEL_ETCD, TYPE_FLANNEL_SERVER);

    private String name;
    private String type = TYPE_FLANNEL_ETCD;
    private Map<String, Object> options = new LinkedHashMap<>();

    public void validate() throws ModelValidationException {
        if (name == null || name.isEmpty()) {
            throw new ModelValidationException("Network name must be a non-empty string");
        }
        if (!TYPES.contains(type)) {
            throw new ModelValidationException("Network type must be one of " + TYPES + ", got \"" + type + "\"");
        }
        if (TYPE_FLANNEL_SERVER.equals(type) && (options == null || !options.containsKey("address"))) {
            throw new ModelValidationException("flannel_server networks need an \"address\" option");
        }
    }
}
