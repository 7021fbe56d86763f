package com.leadharvest.scrape.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HashUtilsTest {

    @Test
    void canonicalJsonIgnoresKeyOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", 1);
        first.put("a", Map.of("z", "x", "y", List.of(1, 2)));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("a", Map.of("y", List.of(1, 2), "z", "x"));
        second.put("b", 1);

        assertThat(HashUtils.canonicalJson(first)).isEqualTo("{\"a\":{\"y\":[1,2],\"z\":\"x\"},\"b\":1}");
        assertThat(HashUtils.sha256OfObject(first)).isEqualTo(HashUtils.sha256OfObject(second));
    }

    @Test
    void canonicalJsonKeepsNonAsciiCharacters() {
        assertThat(HashUtils.canonicalJson(Map.of("name", "Zoë"))).isEqualTo("{\"name\":\"Zoë\"}");
    }

    @Test
    void sha256HexMatchesKnownDigest() {
        assertThat(HashUtils.sha256Hex("abc"))
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void differentValuesProduceDifferentHashes() {
        assertThat(HashUtils.sha256OfObject(Map.of("name", "Alice")))
            .isNotEqualTo(HashUtils.sha256OfObject(Map.of("name", "Bob")))
            .hasSize(64);
    }
}
