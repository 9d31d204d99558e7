package org.commissaire.http.services;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.ToNumberPolicy;

/**
 * Shared Gson setup for everything that crosses a JSON boundary.
 * Integral numbers decode as {@code Long} so ids and counters survive a round trip
 * through untyped maps.
 */
public final class GsonFactory {

    private GsonFactory() {}

    public static Gson create() {
        return new GsonBuilder()
                .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
                .disableHtmlEscaping()
                .create();
    }
}
