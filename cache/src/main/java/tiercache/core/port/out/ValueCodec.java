package tiercache.core.port.out;

import tiercache.core.exception.CacheDecodingException;
import tiercache.core.exception.CacheEncodingException;

/**
 * Port for turning values into cache payloads and back.
 */
public interface ValueCodec {

    /**
     * Encode a value.
     *
     * @param value any structurally serializable value
     * @return the payload
     * @throws CacheEncodingException if the value cannot be encoded
     */
    byte[] encode(Object value);

    /**
     * Decode a payload.
     *
     * @param payload bytes produced by {@link #encode}
     * @param type the target type
     * @return the decoded value
     * @throws CacheDecodingException if the payload does not fit the type
     */
    <T> T decode(byte[] payload, Class<T> type);
}
