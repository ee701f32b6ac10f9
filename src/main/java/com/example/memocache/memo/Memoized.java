package com.example.memocache.memo;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Caches the annotated Spring bean method's result through the application {@link Memoizer}.
 *
 * <pre>{@code
 * @Memoized(name = "ec2.instances", key = "#region", ttlSeconds = 300)
 * public List<Instance> describeInstances(String region) { ... }
 * }</pre>
 *
 * @see MemoizedAspect
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Memoized {

    /** Function identity used as key prefix; defaults to {@code DeclaringClass#method}. */
    String name() default "";

    /**
     * SpEL expression over the method parameters giving the key suffix, e.g. {@code "#region"}.
     * Empty means the {@link Memoizer}'s default key generator over all arguments.
     */
    String key() default "";

    /** TTL in seconds; {@code 0} means the memoizer's default. */
    long ttlSeconds() default 0;
}
