package org.commissaire.http.services;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.InvokeRequest;
import software.amazon.awssdk.services.lambda.model.InvokeResponse;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link RemoteCallClient} that sends each JSON-RPC request to the storage
 * function through a synchronous Lambda invoke.
 *
 * The request payload is {@code {jsonrpc, id, method, params}}; the function
 * answers with {@code {jsonrpc, id, result}} or {@code {jsonrpc, id, error}}.
 * No retries are made beyond what the SDK client itself is configured for.
 */
public class LambdaRemoteCallClient implements RemoteCallClient {

    private final LambdaClient lambdaClient;
    private final String functionName;
    private final Gson gson = GsonFactory.create();

    public LambdaRemoteCallClient(LambdaClient lambdaClient, String functionName) {
        this.lambdaClient = lambdaClient;
        this.functionName = functionName;
    }

    public static LambdaRemoteCallClient create(DispatcherConfig config) {
        LambdaClient lambdaClient = LambdaClient.builder()
                .region(Region.of(config.getAwsRegion()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(Duration.ofSeconds(config.getCallTimeoutSeconds()))
                        .build())
                .build();
        LoggingService.info("remote_call_client_ready", LoggingService.data(
                "function", config.getStorageFunction(),
                "region", config.getAwsRegion()));
        return new LambdaRemoteCallClient(lambdaClient, config.getStorageFunction());
    }

    @Override
    public Object request(String method, List<Object> params) throws RemoteCallException {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("jsonrpc", "2.0");
        message.put("id", UUID.randomUUID().toString());
        message.put("method", method);
        message.put("params", params == null ? List.of() : new ArrayList<>(params));
        String payload = gson.toJson(message);

        InvokeResponse response;
        try {
            response = lambdaClient.invoke(InvokeRequest.builder()
                    .functionName(functionName)
                    .payload(SdkBytes.fromUtf8String(payload))
                    .build());
        } catch (SdkException e) {
            throw new RemoteCallException("Failed to invoke " + functionName + " for " + method, e);
        }

        String responsePayload = response.payload() == null ? "" : response.payload().asUtf8String();
        if (response.functionError() != null) {
            throw new RemoteCallException("Function " + functionName + " failed handling " + method
                    + " (" + response.functionError() + "): " + responsePayload);
        }
        return readResult(method, message.get("id"), responsePayload);
    }

    private Object readResult(String method, Object requestId, String responsePayload) throws RemoteCallException {
        JsonObject json;
        try {
            JsonElement element = JsonParser.parseString(responsePayload);
            if (!element.isJsonObject()) {
                throw new RemoteCallException("Response to " + method + " is not a JSON object");
            }
            json = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new RemoteCallException("Response to " + method + " is not valid JSON", e);
        }

        if (json.has("id") && !json.get("id").isJsonNull() && !json.get("id").getAsString().equals(requestId)) {
            LoggingService.warn("remote_call_id_mismatch", LoggingService.data(
                    "method", method, "sent", requestId, "received", json.get("id").getAsString()));
        }

        if (json.has("error") && !json.get("error").isJsonNull()) {
            JsonElement error = json.get("error");
            if (error.isJsonObject()) {
                JsonObject errorObject = error.getAsJsonObject();
                Integer code = errorObject.has("code") ? errorObject.get("code").getAsInt() : null;
                String errorMessage = errorObject.has("message") ? errorObject.get("message").getAsString() : error.toString();
                throw new RemoteCallException(code, errorMessage);
            }
            throw new RemoteCallException(error.toString());
        }
        if (!json.has("result")) {
            throw new RemoteCallException("Response to " + method + " has neither result nor error");
        }
        return gson.fromJson(json.get("result"), Object.class);
    }
}
