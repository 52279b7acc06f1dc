package io.chunklite.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AddressSpec {

    @Test
    void hash_is_deterministic_and_content_derived() {
        Address a1 = Address.hashOf("hello".getBytes(StandardCharsets.UTF_8));
        Address a2 = Address.hashOf("hello".getBytes(StandardCharsets.UTF_8));
        Address b = Address.hashOf("world".getBytes(StandardCharsets.UTF_8));

        assertEquals(a1, a2);
        assertEquals(a1.hashCode(), a2.hashCode());
        assertNotEquals(a1, b);
        // well-known SHA-256("hello")
        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824", a1.hex());
    }

    @Test
    void hex_form_parses_back_to_an_equal_key() {
        Address a = Address.hashOf(new byte[]{1, 2, 3});
        Map<Address, String> m = new HashMap<>();
        m.put(a, "x");

        assertEquals("x", m.get(Address.fromHex(a.hex())));
        assertEquals(a, Address.fromHex(a.hex().toUpperCase()));
    }

    @Test
    void rejects_wrong_length_and_non_hex_input() {
        assertThrows(IllegalArgumentException.class, () -> Address.of(new byte[31]));
        assertThrows(IllegalArgumentException.class, () -> Address.fromHex("abcd"));
        assertThrows(IllegalArgumentException.class, () -> Address.fromHex("z".repeat(64)));
    }

    @Test
    void bytes_are_copied_defensively() {
        byte[] digest = new byte[Address.LENGTH];
        Address a = Address.of(digest);
        digest[0] = 42;
        a.bytes()[1] = 42;

        assertArrayEquals(new byte[Address.LENGTH], a.bytes());
    }

    @Test
    void chunk_of_derives_its_address_from_payload() {
        byte[] payload = "payload".getBytes(StandardCharsets.UTF_8);
        Chunk c = Chunk.of(payload);

        assertEquals(Address.hashOf(payload), c.address());
        assertArrayEquals(payload, c.data());
        assertEquals(payload.length, c.size());
        assertEquals(c, new Chunk(c.address(), payload));
    }
}
