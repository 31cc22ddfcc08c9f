package com.intteq.consumer.dispatch.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.consumer.dispatch.exception.BodyCodecException;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Converts between message bodies and handler values.
 *
 * <ul>
 *     <li>{@code byte[]} passes through unchanged (the array is shared, not copied)</li>
 *     <li>{@code String} is UTF-8 decoded / encoded</li>
 *     <li>anything else is read from / written to UTF-8 JSON with the configured {@link ObjectMapper}</li>
 * </ul>
 *
 * <p>Thread-safe once constructed.
 */
public class BodyCodec {

    private static final byte[] EMPTY = new byte[0];

    private final ObjectMapper objectMapper;

    public BodyCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Decodes a body into the given target type.
     *
     * @param body       raw body; {@code null} yields {@code null}
     * @param targetType declared (possibly generic) parameter type
     * @return the decoded value; {@code null} for an absent body, and for an empty body
     *         that is to be read as JSON
     * @throws BodyCodecException if the body is not valid JSON for the target type
     */
    @Nullable
    public Object decode(@Nullable byte[] body, Type targetType) {
        if (body == null) {
            return null;
        }
        if (targetType == byte[].class) {
            return body;
        }
        if (targetType == String.class) {
            return new String(body, StandardCharsets.UTF_8);
        }
        if (body.length == 0) {
            return null;
        }

        JavaType javaType = objectMapper.getTypeFactory().constructType(targetType);
        try {
            return objectMapper.readValue(new String(body, StandardCharsets.UTF_8), javaType);
        } catch (IOException e) {
            throw new BodyCodecException(
                    "Failed to deserialize message body to " + javaType.toCanonical(), e);
        }
    }

    /**
     * Encodes a handler result.
     *
     * @param value handler return value; {@code null} yields an empty array
     * @throws BodyCodecException if the value cannot be serialized to JSON
     */
    public byte[] encode(@Nullable Object value) {
        if (value == null) {
            return EMPTY;
        }
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        if (value instanceof String text) {
            return text.getBytes(StandardCharsets.UTF_8);
        }

        try {
            return objectMapper.writeValueAsString(value).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new BodyCodecException(
                    "Failed to serialize handler result: " + value.getClass().getName(), e);
        }
    }
}
