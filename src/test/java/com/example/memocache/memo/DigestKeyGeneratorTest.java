package com.example.memocache.memo;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.memocache.core.LocalCache;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DigestKeyGeneratorTest {

    private final DigestKeyGenerator keys = new DigestKeyGenerator();

    @Test
    @DisplayName("same function and arguments give the same key")
    void deterministic() {
        assertThat(keys.generate("ec2.describe", "us-east-1", 5))
            .isEqualTo(keys.generate("ec2.describe", "us-east-1", 5))
            .startsWith("ec2.describe:")
            .matches("ec2\\.describe:[0-9a-f]{32}");
    }

    @Test
    @DisplayName("function id is part of the key")
    void functionIdMatters() {
        assertThat(keys.generate("a", "x")).isNotEqualTo(keys.generate("b", "x"));
    }

    @Test
    @DisplayName("argument type is part of the key")
    void typeMatters() {
        assertThat(keys.generate("f", "1")).isNotEqualTo(keys.generate("f", 1));
        assertThat(keys.generate("f", 1)).isNotEqualTo(keys.generate("f", 1L));
    }

    @Test
    @DisplayName("argument order is part of the key")
    void orderMatters() {
        assertThat(keys.generate("f", "a", "b")).isNotEqualTo(keys.generate("f", "b", "a"));
    }

    @Test
    @DisplayName("map arguments are independent of insertion order")
    void mapOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("region", "us-east-1");
        first.put("limit", 10);
        Map<String, Object> second = new HashMap<>();
        second.put("limit", 10);
        second.put("region", "us-east-1");

        assertThat(keys.generate("f", first)).isEqualTo(keys.generate("f", second));
    }

    @Test
    @DisplayName("arrays are compared by content")
    void arrays() {
        assertThat(keys.generate("f", (Object) new int[] {1, 2}))
            .isEqualTo(keys.generate("f", (Object) new int[] {1, 2}))
            .isNotEqualTo(keys.generate("f", (Object) new int[] {2, 1}));
    }

    @Test
    @DisplayName("null and no-argument calls have stable canonical forms")
    void canonicalForms() {
        assertThat(DigestKeyGenerator.canonicalArguments(new Object[0])).isEmpty();
        assertThat(DigestKeyGenerator.canonicalArguments(new Object[] {null, "x"}))
            .isEqualTo("null(0)java.lang.String(1)x");
        assertThat(keys.generate("f", (Object) null)).isNotEqualTo(keys.generate("f", "null"));
    }

    @Test
    @DisplayName("separator-like text inside an argument cannot merge two arguments")
    void argumentBoundaries() {
        assertThat(keys.generate("f", "a,java.lang.String=b")).isNotEqualTo(keys.generate("f", "a", "b"));
        assertThat(keys.generate("f", "ab", "c")).isNotEqualTo(keys.generate("f", "a", "bc"));
        assertThat(keys.generate("f", "java.lang.String(1)a")).isNotEqualTo(keys.generate("f", "a", "a"));
    }

    @Test
    @DisplayName("collection elements keep their types")
    void collectionElementTypes() {
        assertThat(keys.generate("f", List.of(1))).isNotEqualTo(keys.generate("f", List.of("1")));
        assertThat(keys.generate("f", List.of(1, 2))).isNotEqualTo(keys.generate("f", List.of(2, 1)));
        assertThat(keys.generate("f", List.of(List.of("a", "b")))).isNotEqualTo(keys.generate("f", List.of(List.of("a"), "b")));
    }

    @Test
    @DisplayName("equal lists and sets match regardless of implementation")
    void collectionImplementations() {
        assertThat(keys.generate("f", new ArrayList<>(List.of("a", "b")))).isEqualTo(keys.generate("f", new LinkedList<>(List.of("a", "b"))));
        assertThat(keys.generate("f", new LinkedHashSet<>(List.of("b", "a")))).isEqualTo(keys.generate("f", new TreeSet<>(Set.of("a", "b"))));
        assertThat(keys.generate("f", List.of("a"))).isNotEqualTo(keys.generate("f", Set.of("a")));
    }

    @Test
    @DisplayName("map keys keep their types")
    void mapKeyTypes() {
        Map<Object, String> byInt = new HashMap<>();
        byInt.put(1, "x");
        Map<Object, String> byString = new HashMap<>();
        byString.put("1", "x");

        assertThat(keys.generate("f", byInt)).isNotEqualTo(keys.generate("f", byString));
    }

    @Test
    @DisplayName("memoized call with a colliding-looking argument runs the target")
    void memoizedCallsDoNotShareResults() {
        Memoizer memoizer = new Memoizer(new LocalCache(60), 60);
        MemoizedFunction<List<?>, String> firstType =
            memoizer.function("first-element-type", list -> list.get(0).getClass().getSimpleName());

        assertThat(firstType.apply(List.of(1))).isEqualTo("Integer");
        assertThat(firstType.apply(List.of("1"))).isEqualTo("String");
    }
}
