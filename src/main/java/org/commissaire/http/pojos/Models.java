package org.commissaire.http.pojos;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import org.commissaire.http.services.GsonFactory;

import java.lang.reflect.Type;
import java.util.Map;

/**
 * Conversions between the untyped maps exchanged with storage and the model classes.
 */
public final class Models {

    private static final Gson gson = GsonFactory.create();
    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    private Models() {}

    public static <T> T fromMap(Map<String, ?> data, Class<T> type) {
        return gson.fromJson(gson.toJsonTree(data), type);
    }

    public static Map<String, Object> toMap(Object model) {
        return gson.fromJson(gson.toJsonTree(model), MAP_TYPE);
    }
}
