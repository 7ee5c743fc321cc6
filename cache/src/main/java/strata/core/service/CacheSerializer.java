package strata.core.service;

import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.TypeFactory;

/**
 * JSON codec for cached values.
 *
 * <p>Both cache tiers store the same JSON text, so a value written to either
 * tier is read back through the same typed lookup.
 */
public class CacheSerializer {

    private final ObjectMapper objectMapper;

    public CacheSerializer() {
        this(new ObjectMapper()
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public CacheSerializer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Serialize a value to JSON.
     *
     * @throws CacheSerializationException if the value cannot be serialized
     */
    public String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException(
                    "Failed to serialize " + value.getClass().getName(), e);
        }
    }

    /**
     * Deserialize JSON to the given type.
     *
     * @throws CacheSerializationException if the payload is corrupt or of another type
     */
    public <T> T deserialize(String json, JavaType type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException("Failed to deserialize " + type, e);
        }
    }

    public JavaType typeOf(Class<?> type) {
        return typeFactory().constructType(type);
    }

    public JavaType typeOf(TypeReference<?> type) {
        return typeFactory().constructType(type);
    }

    /**
     * Build a parameterized type such as {@code PageResult<Listing>}.
     */
    public JavaType parametricType(Class<?> rawType, Class<?>... parameterTypes) {
        return typeFactory().constructParametricType(rawType, parameterTypes);
    }

    private TypeFactory typeFactory() {
        return objectMapper.getTypeFactory();
    }
}
