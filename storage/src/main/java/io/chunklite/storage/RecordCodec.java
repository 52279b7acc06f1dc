// file: src/main/java/io/chunklite/storage/RecordCodec.java
package io.chunklite.storage;

import io.chunklite.core.Address;
import io.chunklite.core.Chunk;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.zip.CRC32;

/**
 * Binary framing for chunk records in the WAL.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xC4C1
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD]
 *     - address: 32 bytes
 *     - dataLen: int32
 *     - data:    dataLen bytes
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xC4C1;
    static final byte  VERSION = 1;
    static final int   HEADER_BYTES = 2 + 1 + 4 + 4;

    private RecordCodec() {
    }

    /** Encode a chunk into header+payload bytes ready for append. */
    static byte[] encode(Chunk chunk) {
        byte[] payload = encodePayload(chunk);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Decode a full payload (not including header). */
    static Chunk decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        if (b.remaining() < Address.LENGTH + 4) {
            throw new ChunkStoreException("record payload too short: " + payload.length + " bytes");
        }
        byte[] addr = new byte[Address.LENGTH];
        b.get(addr);
        int len = b.getInt();
        if (len < 0 || len != b.remaining()) {
            throw new ChunkStoreException("record data length " + len + " does not match payload");
        }
        byte[] data = new byte[len];
        b.get(data);
        return new Chunk(Address.of(addr), data);
    }

    /**
     * Parse a header.
     *
     * @return payload length and expected CRC, or null if the header is not a valid record header
     */
    static Header readHeader(ByteBuffer hdr) {
        hdr.order(ByteOrder.LITTLE_ENDIAN);
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != MAGIC || ver != VERSION || len < 0) {
            return null;
        }
        return new Header(len, crc);
    }

    record Header(int length, int crc) {}

    private static byte[] encodePayload(Chunk chunk) {
        byte[] data = chunk.data();
        ByteBuffer b = ByteBuffer.allocate(Address.LENGTH + 4 + data.length).order(ByteOrder.LITTLE_ENDIAN);
        b.put(chunk.address().bytes());
        b.putInt(data.length);
        b.put(data);
        return b.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue(); // compare as signed int on both sides
    }
}
