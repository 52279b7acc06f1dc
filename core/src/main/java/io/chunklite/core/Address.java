// file: src/main/java/io/chunklite/core/Address.java
package io.chunklite.core;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Content address of a chunk: the SHA-256 digest of its payload.
 * <p>
 * Invariants:
 *  - Always exactly {@link #LENGTH} bytes.
 *  - Immutable; bytes are copied on the way in and out.
 *  - equals/hashCode compare the digest bytes, so an Address can be used as a map key.
 */
public final class Address {
    public static final int LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private Address(byte[] bytes) {
        this.bytes = bytes;
    }

    /** Wrap an existing digest. */
    public static Address of(byte[] digest) {
        Objects.requireNonNull(digest, "digest");
        if (digest.length != LENGTH) {
            throw new IllegalArgumentException(
                    "address must be " + LENGTH + " bytes, got " + digest.length);
        }
        return new Address(Arrays.copyOf(digest, LENGTH));
    }

    /** Parse the lowercase/uppercase hex form produced by {@link #hex()}. */
    public static Address fromHex(String hex) {
        Objects.requireNonNull(hex, "hex");
        if (hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException(
                    "address hex must be " + (LENGTH * 2) + " characters, got " + hex.length());
        }
        try {
            return new Address(HEX.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("address is not valid hex: " + hex, e);
        }
    }

    /** Compute the address of a payload. */
    public static Address hashOf(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return new Address(md.digest(payload));
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public byte[] bytes() {
        return Arrays.copyOf(bytes, LENGTH);
    }

    public String hex() {
        return HEX.formatHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Address other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return hex();
    }
}
