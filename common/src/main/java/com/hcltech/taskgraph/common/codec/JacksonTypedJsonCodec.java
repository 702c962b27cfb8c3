package com.hcltech.taskgraph.common.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hcltech.taskgraph.common.errorsor.ErrorsOr;

import java.util.Objects;

public final class JacksonTypedJsonCodec<T> implements Codec<T, String> {
    private final ObjectMapper mapper;
    private final Class<T> klass;
    private final TypeReference<T> typeRef; // set instead of klass for generic types

    public JacksonTypedJsonCodec(Class<T> klass) {
        this(new ObjectMapper(), klass);
    }

    public JacksonTypedJsonCodec(ObjectMapper baseMapper, Class<T> klass) {
        this.mapper = Objects.requireNonNull(baseMapper).copy();
        this.mapper.findAndRegisterModules();
        this.klass = Objects.requireNonNull(klass);
        this.typeRef = null;
    }

    public JacksonTypedJsonCodec(TypeReference<T> typeRef) {
        this(new ObjectMapper(), typeRef);
    }

    public JacksonTypedJsonCodec(ObjectMapper baseMapper, TypeReference<T> typeRef) {
        this.mapper = Objects.requireNonNull(baseMapper).copy();
        this.mapper.findAndRegisterModules();
        this.klass = null;
        this.typeRef = Objects.requireNonNull(typeRef);
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        return ErrorsOr.trying(() -> mapper.writeValueAsString(value),
                e -> "Failed to encode to JSON: " + e.getMessage());
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        if (json == null || json.isBlank()) return ErrorsOr.error("Failed to decode from JSON: input is empty");
        return ErrorsOr.trying(() -> klass != null ? mapper.readValue(json, klass) : mapper.readValue(json, typeRef),
                e -> "Failed to decode from JSON: " + e.getMessage());
    }

    public ObjectMapper objectMapper() {
        return mapper;
    }
}
