package io.github.adscache.core;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives stable cache keys from a namespace and a parameter bag.
 *
 * <p>Parameters are converted to a Jackson tree, canonicalized (object fields sorted
 * lexicographically at every depth, decimal numbers normalized) and hashed with SHA-256.
 * The resulting key is {@code namespace + ":" + 64 hex chars}, so two calls with the same
 * namespace and structurally equal parameters always produce the same key, independent of
 * map insertion order and of the process that computed it.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public class CacheKeyGenerator {
    private static final Logger logger = LoggerFactory.getLogger(CacheKeyGenerator.class);

    /** Separator between namespace and digest. */
    public static final char NAMESPACE_SEPARATOR = ':';

    private final ObjectMapper objectMapper;

    public CacheKeyGenerator() {
        this(new ObjectMapper());
    }

    /**
     * @param objectMapper mapper used to turn parameter objects into trees; copied and forced to
     *                     fail on beans without serializable properties
     */
    public CacheKeyGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * Generates the cache key for a namespace and a parameter bag.
     *
     * @param namespace logical operation name, for example {@code "campaigns"}; must not be empty
     * @param params    a {@link Map}, {@link JsonNode}, bean, collection or scalar; {@code null}
     *                  is treated as an empty parameter bag
     * @return {@code namespace:sha256hex}
     * @throws InvalidParameterException if the namespace is empty or a parameter cannot be
     *                                   represented as JSON
     */
    public String key(String namespace, Object params) {
        if (namespace == null || namespace.isEmpty()) {
            throw new InvalidParameterException("Cache key namespace cannot be null or empty");
        }

        String canonical = canonicalJson(params);
        String key = namespace + NAMESPACE_SEPARATOR + DigestUtils.sha256Hex(canonical);
        logger.trace("Generated cache key '{}' from {}", key, canonical);
        return key;
    }

    /**
     * Generates the cache key for a namespace without parameters.
     */
    public String key(String namespace) {
        return key(namespace, null);
    }

    /**
     * Returns the canonical JSON form that {@link #key(String, Object)} hashes.
     *
     * @throws InvalidParameterException if a parameter cannot be represented as JSON
     */
    public String canonicalJson(Object params) {
        JsonNode tree = toTree(params);
        try {
            return objectMapper.writeValueAsString(canonicalize(tree));
        } catch (JsonProcessingException e) {
            throw new InvalidParameterException("Failed to serialize cache key parameters", e);
        }
    }

    /**
     * Extracts the namespace part of a key produced by this generator.
     * A key without separator is its own namespace.
     */
    public static String namespaceOf(String key) {
        int idx = key.indexOf(NAMESPACE_SEPARATOR);
        return idx < 0 ? key : key.substring(0, idx);
    }

    private JsonNode toTree(Object params) {
        if (params == null) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (params instanceof JsonNode) {
            return (JsonNode) params;
        }
        requireAcyclic(params);
        try {
            return objectMapper.valueToTree(params);
        } catch (IllegalArgumentException e) {
            throw new InvalidParameterException(
                "Cache key parameters of type " + params.getClass().getName() + " are not serializable", e);
        }
    }

    /**
     * Rejects maps, collections and arrays that contain themselves, directly or through a
     * nested container. Jackson would otherwise recurse until the stack overflows.
     *
     * @throws InvalidParameterException if a cycle is found
     */
    static void requireAcyclic(Object value) {
        checkAcyclic(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static void checkAcyclic(Object value, Set<Object> path) {
        if (!(value instanceof Map || value instanceof Iterable || value instanceof Object[])) {
            return;
        }
        if (!path.add(value)) {
            throw new InvalidParameterException(
                "Cache parameters of type " + value.getClass().getName() + " contain a reference to themselves");
        }
        if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                checkAcyclic(entry.getKey(), path);
                checkAcyclic(entry.getValue(), path);
            }
        } else if (value instanceof Iterable) {
            for (Object element : (Iterable<?>) value) {
                checkAcyclic(element, path);
            }
        } else {
            for (Object element : (Object[]) value) {
                checkAcyclic(element, path);
            }
        }
        // shared, non-cyclic references are allowed
        path.remove(value);
    }

    private JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            List<String> fieldNames = new ArrayList<>();
            Iterator<String> names = node.fieldNames();
            names.forEachRemaining(fieldNames::add);
            Collections.sort(fieldNames);

            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            for (String fieldName : fieldNames) {
                sorted.set(fieldName, canonicalize(node.get(fieldName)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode elements = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : node) {
                elements.add(canonicalize(element));
            }
            return elements;
        }
        if (node.isFloatingPointNumber()) {
            return canonicalizeDecimal(node);
        }
        if (node.isPojo() || node.isBinary() || node.isMissingNode()) {
            throw new InvalidParameterException("Cache key parameter of node type " + node.getNodeType() + " is not serializable");
        }
        return node;
    }

    // 42.0f, 42.0d and 42.00 must hash the same; 42 (integral) stays distinct
    private JsonNode canonicalizeDecimal(JsonNode node) {
        if (node.isDouble() || node.isFloat()) {
            double value = node.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new InvalidParameterException("Cache key parameter is not a finite number: " + value);
            }
        }
        BigDecimal normalized = node.decimalValue().stripTrailingZeros();
        if (normalized.scale() <= 0) {
            normalized = normalized.setScale(1);
        }
        return JsonNodeFactory.instance.numberNode(normalized);
    }
}
