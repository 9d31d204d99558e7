package org.commissaire.http.handlers;

import org.commissaire.http.pojos.CallEnvelope;
import org.commissaire.http.pojos.CallResult;
import org.commissaire.http.pojos.ModelValidationException;
import org.commissaire.http.pojos.Models;
import org.commissaire.http.pojos.Network;
import org.commissaire.http.pojos.RpcErrorCode;
import org.commissaire.http.rest.HandlerCollection;
import org.commissaire.http.rest.HandlerTable;
import org.commissaire.http.services.LoggingService;
import org.commissaire.http.services.RemoteCallClient;
import org.commissaire.http.services.RemoteCallException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.commissaire.http.handlers.HandlerSupport.createResponse;
import static org.commissaire.http.handlers.HandlerSupport.returnError;

public class NetworkHandlers implements HandlerCollection {

    public static final String NAME = "networks";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void describe(HandlerTable table) {
        table.function("listNetworks", this::listNetworks)
                .function("getNetwork", this::getNetwork)
                .function("createNetwork", this::createNetwork)
                .function("deleteNetwork", this::deleteNetwork);
    }

    CallResult listNetworks(CallEnvelope envelope, RemoteCallClient client) throws RemoteCallException {
        List<String> names = new ArrayList<>();
        for (Object entry : new StorageCalls(client).list("Networks")) {
            if (entry instanceof Map) {
                names.add(String.valueOf(((Map<?, ?>) entry).get("name")));
            }
        }
        return createResponse(envelope.getId(), names);
    }

    CallResult getNetwork(CallEnvelope envelope, RemoteCallClient client) {
        String name = envelope.getStringParam("name");
        try {
            Map<String, Object> stored = new StorageCalls(client).get("Network", Map.of("name", name));
            return createResponse(envelope.getId(), Models.toMap(Models.fromMap(stored, Network.class)));
        } catch (RemoteCallException e) {
            LoggingService.debug("network_not_found", LoggingService.data("network", name));
            return returnError(envelope, e, RpcErrorCode.NOT_FOUND);
        }
    }

    /**
     * Saves a new network. An existing network of the same name is returned as is.
     */
    CallResult createNetwork(CallEnvelope envelope, RemoteCallClient client) throws RemoteCallException {
        StorageCalls storage = new StorageCalls(client);
        String name = envelope.getStringParam("name");
        try {
            Map<String, Object> existing = storage.get("Network", Map.of("name", name));
            LoggingService.debug("network_already_exists", LoggingService.data("network", name));
            return createResponse(envelope.getId(), Models.toMap(Models.fromMap(existing, Network.class)));
        } catch (RemoteCallException e) {
            LoggingService.debug("network_creating", LoggingService.data("network", name));
        }

        Network network = Models.fromMap(envelope.getParams(), Network.class);
        try {
            network.validate();
        } catch (ModelValidationException e) {
            return returnError(envelope, e, RpcErrorCode.INVALID_REQUEST);
        }
        Map<String, Object> saved = storage.save("Network", Models.toMap(network));
        return createResponse(envelope.getId(), Models.toMap(Models.fromMap(saved, Network.class)));
    }

    CallResult deleteNetwork(CallEnvelope envelope, RemoteCallClient client) {
        String name = envelope.getStringParam("name");
        try {
            new StorageCalls(client).delete("Network", Map.of("name", name));
            return createResponse(envelope.getId(), List.of());
        } catch (RemoteCallException e) {
            LoggingService.debug("network_delete_failed", LoggingService.data("network", name, "error", e.getMessage()));
            return returnError(envelope, e, RpcErrorCode.NOT_FOUND);
        }
    }
}
