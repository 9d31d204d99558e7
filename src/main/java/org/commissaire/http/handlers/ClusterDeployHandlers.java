package org.commissaire.http.handlers;

import org.commissaire.http.pojos.CallEnvelope;
import org.commissaire.http.pojos.CallResult;
import org.commissaire.http.pojos.ClusterDeploy;
import org.commissaire.http.pojos.ModelValidationException;
import org.commissaire.http.pojos.Models;
import org.commissaire.http.pojos.RpcErrorCode;
import org.commissaire.http.rest.HandlerCollection;
import org.commissaire.http.rest.HandlerTable;
import org.commissaire.http.services.LoggingService;
import org.commissaire.http.services.RemoteCallClient;
import org.commissaire.http.services.RemoteCallException;

import java.util.Map;

import static org.commissaire.http.handlers.HandlerSupport.createResponse;
import static org.commissaire.http.handlers.HandlerSupport.returnError;

/**
 * Cluster-wide operations. Only deployments exist so far.
 */
public class ClusterDeployHandlers implements HandlerCollection {

    public static final String NAME = "clusters.operations";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void describe(HandlerTable table) {
        table.function("getClusterDeploy", this::getClusterDeploy)
                .function("createClusterDeploy", this::createClusterDeploy);
    }

    CallResult getClusterDeploy(CallEnvelope envelope, RemoteCallClient client) {
        try {
            Map<String, Object> stored = new StorageCalls(client).get(
                    "ClusterDeploy", Map.of("name", envelope.getStringParam("name")), true);
            ClusterDeploy deploy = Models.fromMap(stored, ClusterDeploy.class);
            deploy.validate();
            return createResponse(envelope.getId(), Models.toMap(deploy));
        } catch (ModelValidationException e) {
            LoggingService.info("cluster_deploy_invalid", LoggingService.data("error", e.getMessage()));
            return returnError(envelope, e, RpcErrorCode.INVALID_REQUEST);
        } catch (RemoteCallException e) {
            LoggingService.debug("cluster_deploy_get_failed", LoggingService.data("error", e.getMessage()));
            return returnError(envelope, e, RpcErrorCode.INTERNAL_ERROR);
        }
    }

    CallResult createClusterDeploy(CallEnvelope envelope, RemoteCallClient client) {
        try {
            ClusterDeploy deploy = new ClusterDeploy(
                    envelope.getStringParam("name"), envelope.getStringParam("version"));
            deploy.validate();
            // TODO: start the deploy job once the deploy service exposes a call for it
            Map<String, Object> saved = new StorageCalls(client).save("ClusterDeploy", Models.toMap(deploy));
            return createResponse(envelope.getId(), saved);
        } catch (ModelValidationException e) {
            LoggingService.info("cluster_deploy_invalid", LoggingService.data(
                    "error", e.getMessage(), "params", envelope.getParams()));
            return returnError(envelope, e, RpcErrorCode.INVALID_REQUEST);
        } catch (RemoteCallException e) {
            LoggingService.debug("cluster_deploy_create_failed", LoggingService.data("error", e.getMessage()));
            return returnError(envelope, e, RpcErrorCode.INTERNAL_ERROR);
        }
    }
}
