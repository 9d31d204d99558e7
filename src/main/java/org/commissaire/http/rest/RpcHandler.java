package org.commissaire.http.rest;

import org.commissaire.http.pojos.CallEnvelope;
import org.commissaire.http.pojos.CallResult;
import org.commissaire.http.services.RemoteCallClient;

/**
 * A unit of domain logic the dispatcher can route to.
 *
 * Implementations answer with a {@link CallResult} carrying the envelope's id.
 * Anything thrown is reported to the HTTP caller as a 500.
 */
@FunctionalInterface
public interface RpcHandler {
    CallResult handle(CallEnvelope envelope, RemoteCallClient client) throws Exception;
}
