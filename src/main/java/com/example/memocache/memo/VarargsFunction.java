package com.example.memocache.memo;

/** A function of any number of positional arguments. */
@FunctionalInterface
public interface VarargsFunction<R> {

    R apply(Object... args);
}
