package com.hartwig.alignpipe.storage;

import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * JSON form of a {@link DurableHandle}.
 */
public final class HandleSerializer {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().registerModule(new Jdk8Module());

    private HandleSerializer() {
    }

    public static byte[] toJson(DurableHandle handle) throws IOException {
        return OBJECT_MAPPER.writeValueAsBytes(handle);
    }

    public static DurableHandle fromJson(byte[] json) throws IOException {
        return OBJECT_MAPPER.readValue(json, DurableHandle.class);
    }
}
