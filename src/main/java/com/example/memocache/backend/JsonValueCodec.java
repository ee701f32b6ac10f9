package com.example.memocache.backend;

import com.example.memocache.core.CacheSerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;
import java.util.List;

/**
 * Encodes cached values as JSON carrying their runtime types, so a value read back from the
 * remote tier has the class it was stored with (nested collection elements included).
 *
 * <p>Only types under the trusted package prefixes may be instantiated.
 */
public class JsonValueCodec {

    public static final List<String> DEFAULT_TRUSTED_PACKAGES =
        List.of("java.lang.", "java.util.", "java.time.", "java.math.");

    private final ObjectMapper objectMapper;

    public JsonValueCodec(ObjectMapper baseMapper, List<String> trustedPackages) {
        this.objectMapper = baseMapper.copy();
        this.objectMapper.activateDefaultTyping(typeValidator(trustedPackages), ObjectMapper.DefaultTyping.EVERYTHING);
    }

    public JsonValueCodec(List<String> trustedPackages) {
        this(new ObjectMapper().findAndRegisterModules(), trustedPackages);
    }

    /**
     * Writes {@code value} and reads the payload back once, so a value that could not be decoded
     * later (an untrusted type, a class Jackson cannot construct) fails here, before it is sent.
     */
    public String encode(Object value) {
        String payload;
        try {
            payload = objectMapper.writerFor(Object.class).writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException(
                "Cannot encode value of type " + value.getClass().getName(), e);
        }
        try {
            objectMapper.readValue(payload, Object.class);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException(
                "Value of type " + value.getClass().getName() + " cannot be read back; is its package trusted?", e);
        }
        return payload;
    }

    public Object decode(String payload) {
        try {
            return objectMapper.readValue(payload, Object.class);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException("Cannot decode cached payload", e);
        }
    }

    private static PolymorphicTypeValidator typeValidator(List<String> trustedPackages) {
        BasicPolymorphicTypeValidator.Builder builder = BasicPolymorphicTypeValidator.builder()
            .allowIfSubTypeIsArray();
        for (String prefix : trustedPackages) {
            builder.allowIfSubType(prefix);
        }
        return builder.build();
    }
}
