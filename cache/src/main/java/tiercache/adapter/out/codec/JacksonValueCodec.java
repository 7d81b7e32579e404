package tiercache.adapter.out.codec;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import tiercache.core.exception.CacheDecodingException;
import tiercache.core.exception.CacheEncodingException;
import tiercache.core.port.out.ValueCodec;

/**
 * JSON value codec backed by Jackson.
 *
 * <p>Accepts primitives, strings, collections, maps, records and beans. Values
 * Jackson cannot serialize (for example an object with no properties) fail with
 * {@link CacheEncodingException}.
 */
public class JacksonValueCodec implements ValueCodec {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ObjectMapper objectMapper;

    public JacksonValueCodec() {
        this(DEFAULT_MAPPER);
    }

    public JacksonValueCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] encode(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CacheEncodingException("Failed to encode " + typeName(value) + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public <T> T decode(byte[] payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (IOException e) {
            throw new CacheDecodingException("Failed to decode payload as " + type.getName(), e);
        }
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
