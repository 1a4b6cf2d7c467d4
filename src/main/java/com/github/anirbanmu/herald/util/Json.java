package com.github.anirbanmu.herald.util;

import com.dslplatform.json.DslJson;
import com.dslplatform.json.runtime.Settings;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

public final class Json {
    public static final DslJson<Object> DSL = new DslJson<>(Settings.withRuntime().includeServiceLoader());

    private Json() {
    }

    public static byte[] toBytes(Object value) throws IOException {
        ByteArrayOutputStream os = new ByteArrayOutputStream();
        DSL.serialize(value, os);
        return os.toByteArray();
    }

    public static <T> T fromBytes(Class<T> type, byte[] bytes) throws IOException {
        T value = DSL.deserialize(type, bytes, bytes.length);
        if (value == null) {
            throw new IOException("Expected " + type.getSimpleName() + " but got null");
        }
        return value;
    }
}
