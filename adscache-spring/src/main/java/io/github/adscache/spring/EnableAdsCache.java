package io.github.adscache.spring;

import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enables Spring's caching support backed by the tiered cache.
 *
 * Usage:
 * <pre>
 * {@code
 * @SpringBootApplication
 * @EnableAdsCache
 * public class Application {
 *     public static void main(String[] args) {
 *         SpringApplication.run(Application.class, args);
 *     }
 * }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@EnableCaching
@Import(AdsCacheConfiguration.class)
public @interface EnableAdsCache {
}
