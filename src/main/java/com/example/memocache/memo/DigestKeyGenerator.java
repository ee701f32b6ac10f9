package com.example.memocache.memo;

import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.util.DigestUtils;

/**
 * Default key: {@code functionId + ":" + md5(canonical arguments)}.
 *
 * <p>Every argument becomes a token {@code type(length)body}; containers nest the tokens of their
 * elements in the body. Because each token states its own length, no two different argument
 * lists share a canonical form. {@code "1"}, {@code 1} and {@code 1L} are different calls; a
 * {@link List}, {@link Set} or {@link Map} matches any other equal one of the same kind, whatever
 * its implementation or iteration order. A {@code Map} argument stands in for keyword arguments.
 */
public class DigestKeyGenerator implements KeyGenerator {

    @Override
    public String generate(String functionId, Object... args) {
        String canonical = canonicalArguments(args);
        return functionId + ":" + DigestUtils.md5DigestAsHex(canonical.getBytes(StandardCharsets.UTF_8));
    }

    static String canonicalArguments(Object[] args) {
        StringBuilder out = new StringBuilder();
        if (args != null) {
            for (Object arg : args) {
                out.append(canonical(arg));
            }
        }
        return out.toString();
    }

    private static String canonical(Object arg) {
        if (arg == null) {
            return token("null", "");
        }
        if (arg instanceof Map) {
            List<String> entries = new ArrayList<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) arg).entrySet()) {
                entries.add(canonical(e.getKey()) + canonical(e.getValue()));
            }
            Collections.sort(entries);
            return token("java.util.Map", String.join("", entries));
        }
        if (arg instanceof Set) {
            List<String> elements = new ArrayList<>();
            for (Object element : (Set<?>) arg) {
                elements.add(canonical(element));
            }
            Collections.sort(elements);
            return token("java.util.Set", String.join("", elements));
        }
        if (arg instanceof Iterable) {
            StringBuilder body = new StringBuilder();
            for (Object element : (Iterable<?>) arg) {
                body.append(canonical(element));
            }
            return token(arg instanceof List ? "java.util.List" : arg.getClass().getName(), body.toString());
        }
        if (arg.getClass().isArray()) {
            StringBuilder body = new StringBuilder();
            int length = Array.getLength(arg);
            for (int i = 0; i < length; i++) {
                body.append(canonical(Array.get(arg, i)));
            }
            return token(arg.getClass().getComponentType().getName() + "[]", body.toString());
        }
        return token(arg.getClass().getName(), String.valueOf(arg));
    }

    // type names never contain '(' and "null" is not a legal class name
    private static String token(String type, String body) {
        return type + "(" + body.length() + ")" + body;
    }
}
