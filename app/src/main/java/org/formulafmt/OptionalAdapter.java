package org.formulafmt;

import com.google.gson.*;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Optional;

// Gson can't look inside java.util.Optional on its own, a missing closing
// token or an empty formula is written as null instead.
class OptionalAdapter implements JsonSerializer<Optional<?>> {

    @Override
    public JsonElement serialize(Optional<?> src, Type typeOfSrc, JsonSerializationContext context) {
        if (src.isEmpty()) {
            return JsonNull.INSTANCE;
        }
        return context.serialize(src.get(), innerType(typeOfSrc));
    }

    // The T in Optional<T>, or Object for a raw Optional
    private static Type innerType(Type optionalType) {
        if (optionalType instanceof ParameterizedType parameterized) {
            return parameterized.getActualTypeArguments()[0];
        }
        return Object.class;
    }

    static Gson gson() {
        return new GsonBuilder()
            .registerTypeHierarchyAdapter(Optional.class, new OptionalAdapter())
            .serializeNulls()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();
    }
}
