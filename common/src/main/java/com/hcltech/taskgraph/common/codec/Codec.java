package com.hcltech.taskgraph.common.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.hcltech.taskgraph.common.errorsor.ErrorsOr;

public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);

    static <T> Codec<T, String> clazzCodec(Class<T> klass) {
        return new JacksonTypedJsonCodec<>(klass);
    }

    /** For generic targets such as {@code Map<String, List<String>>}. */
    static <T> Codec<T, String> typeRefCodec(TypeReference<T> typeRef) {
        return new JacksonTypedJsonCodec<>(typeRef);
    }
}
