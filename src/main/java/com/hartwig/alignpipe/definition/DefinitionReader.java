package com.hartwig.alignpipe.definition;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

public class DefinitionReader {
    private final ObjectMapper objectMapper;

    public DefinitionReader() {
        objectMapper = new ObjectMapper(new YAMLFactory());
        objectMapper.registerModule(new Jdk8Module());
    }

    public ReferenceSet readReferences(InputStream references) throws IOException {
        return objectMapper.readValue(references, ReferenceSet.class);
    }
}
