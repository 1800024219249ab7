package io.github.adscache.spring;

import org.springframework.cache.interceptor.KeyGenerator;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Collections;

/**
 * {@link KeyGenerator} for {@code @Cacheable} methods whose keys end up fingerprinted as JSON.
 *
 * <p>Spring's default {@code SimpleKey} only exposes its arguments through {@code toString()},
 * where {@code 1} and {@code "1"} look the same. This generator hands the arguments over as a
 * list instead, so argument types survive into the cache key. A single non-array argument is
 * used as is, matching Spring's default.</p>
 */
public class MethodArgumentsKeyGenerator implements KeyGenerator {

    @Override
    public Object generate(Object target, Method method, Object... params) {
        if (params.length == 0) {
            return Collections.emptyList();
        }
        if (params.length == 1 && params[0] != null && !params[0].getClass().isArray()) {
            return params[0];
        }
        return Collections.unmodifiableList(Arrays.asList(params.clone()));
    }
}
