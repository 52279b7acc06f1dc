// file: src/main/java/io/chunklite/storage/FileWal.java
package io.chunklite.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - opens every existing segment ("00000001.log", "00000002.log", ...),
 *      - scans the newest segment and truncates a torn/corrupt tail, so new
 *        appends never land behind garbage,
 *      - positions the newest segment for append.
 * <p>
 *  - append(): writes the bytes, no fsync.
 *  - sync(): force(true) on the current segment; older segments were forced
 *    when they were rotated out.
 *  - rotateIfNeeded(): when written bytes >= rotateBytes, forces the current
 *    segment and opens the next one. Old segments stay open for reads.
 * <p>
 *  - Reader: walks all segments oldest first, validating magic/version/length
 *    and CRC; a bad record ends the scan of its segment.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private final ConcurrentSkipListMap<Integer, FileChannel> segments = new ConcurrentSkipListMap<>();

    private FileChannel ch;
    private int currentIndex;
    private long writtenInSegment;
    private long appendedPosition;
    private volatile long syncedPosition;
    private boolean closed;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new ChunkStoreException("cannot create WAL dir " + dir, e); }
        openSegments();
    }

    @Override
    public synchronized Location append(byte[] serializedRecord) {
        ensureOpen();
        try {
            long start = writtenInSegment;
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf, start + buf.position());
            }
            writtenInSegment += serializedRecord.length;
            appendedPosition += serializedRecord.length;
            return new Location(
                    currentIndex,
                    start + RecordCodec.HEADER_BYTES,
                    serializedRecord.length - RecordCodec.HEADER_BYTES,
                    appendedPosition
            );
        } catch (IOException e) {
            throw new ChunkStoreException("WAL append failed", e);
        }
    }

    @Override
    public long sync() {
        long target;
        FileChannel toForce;
        synchronized (this) {
            ensureOpen();
            target = appendedPosition;
            toForce = ch;
        }
        if (target <= syncedPosition) {
            return syncedPosition;
        }
        // Force outside the lock so appends are not stalled behind the disk.
        try {
            toForce.force(true);
        } catch (IOException e) {
            throw new ChunkStoreException("WAL fsync failed", e);
        }
        synchronized (this) {
            if (target > syncedPosition) {
                syncedPosition = target;
            }
            return syncedPosition;
        }
    }

    @Override
    public long syncedPosition() {
        return syncedPosition;
    }

    @Override
    public byte[] read(Location location) {
        FileChannel seg = segments.get(location.segment());
        if (seg == null) {
            throw new ChunkStoreException("unknown WAL segment " + location.segment());
        }
        try {
            ByteBuffer buf = ByteBuffer.allocate(RecordCodec.HEADER_BYTES + location.length());
            long at = location.offset() - RecordCodec.HEADER_BYTES;
            while (buf.hasRemaining()) {
                int n = seg.read(buf, at + buf.position());
                if (n < 0) {
                    throw new ChunkStoreException("truncated record in segment " + location.segment()
                            + " at " + at);
                }
            }
            byte[] payload = validate(buf);
            if (payload == null) {
                throw new ChunkStoreException("corrupt record in segment " + location.segment() + " at " + at);
            }
            return payload;
        } catch (IOException e) {
            throw new ChunkStoreException("WAL read failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (closed || writtenInSegment < rotateBytes) return;
        try {
            ch.force(true);
            syncedPosition = appendedPosition;
            currentIndex++;
            ch = FileChannel.open(segmentPath(currentIndex), CREATE, WRITE, READ);
            segments.put(currentIndex, ch);
            writtenInSegment = 0;
            log.fine(() -> "rotated WAL to segment " + currentIndex);
        } catch (IOException e) {
            throw new ChunkStoreException("WAL rotation failed", e);
        }
    }

    @Override
    public WalReader openReader() {
        return new Reader(List.copyOf(segments.entrySet()));
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        IOException first = null;
        for (FileChannel seg : segments.values()) {
            try {
                seg.close();
            } catch (IOException e) {
                if (first == null) first = e;
            }
        }
        if (first != null) {
            throw new ChunkStoreException("WAL close failed", first);
        }
    }

    private void ensureOpen() {
        if (closed) throw new ChunkStoreException("WAL is closed");
    }

    /**
     * On startup:
     *  - Open all existing segments for reading; the newest also for append.
     *  - If none exist, create "00000001.log".
     */
    private void openSegments() {
        List<Path> files;
        try (Stream<Path> s = Files.list(dir)) {
            files = s.filter(p -> p.getFileName().toString().endsWith(".log")).sorted().toList();
        } catch (IOException e) {
            throw new ChunkStoreException("cannot list WAL dir " + dir, e);
        }
        try {
            if (files.isEmpty()) {
                files = List.of(segmentPath(1));
            }
            long total = 0;
            for (int i = 0; i < files.size(); i++) {
                Path p = files.get(i);
                int index = Integer.parseInt(p.getFileName().toString().replace(".log", ""));
                boolean newest = i == files.size() - 1;
                FileChannel seg = newest
                        ? FileChannel.open(p, CREATE, WRITE, READ)
                        : FileChannel.open(p, READ);
                segments.put(index, seg);
                if (newest) {
                    long valid = scanValidLength(seg);
                    if (valid < seg.size()) {
                        log.warning("truncating torn WAL tail in " + p.getFileName()
                                + " from " + seg.size() + " to " + valid + " bytes");
                        seg.truncate(valid);
                        seg.force(true);
                    }
                    ch = seg;
                    currentIndex = index;
                    writtenInSegment = valid;
                    total += valid;
                } else {
                    total += seg.size();
                }
            }
            appendedPosition = total;
            syncedPosition = total;
        } catch (IOException e) {
            throw new ChunkStoreException("cannot open WAL segments in " + dir, e);
        }
    }

    private Path segmentPath(int index) {
        return dir.resolve(String.format("%08d.log", index));
    }

    /** Length of the prefix of {@code seg} made of complete, CRC-valid records. */
    private static long scanValidLength(FileChannel seg) throws IOException {
        long pos = 0;
        while (true) {
            long next = nextRecordEnd(seg, pos);
            if (next < 0) return pos;
            pos = next;
        }
    }

    /** End offset of the valid record starting at {@code pos}, or -1. */
    private static long nextRecordEnd(FileChannel seg, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES);
        int read = seg.read(hdr, pos);
        if (read < RecordCodec.HEADER_BYTES) return -1; // EOF or truncated header
        hdr.flip();
        RecordCodec.Header h = RecordCodec.readHeader(hdr);
        if (h == null || pos + RecordCodec.HEADER_BYTES + h.length() > seg.size()) return -1;
        ByteBuffer payload = ByteBuffer.allocate(h.length());
        int r2 = seg.read(payload, pos + RecordCodec.HEADER_BYTES);
        if (r2 < h.length() && h.length() > 0) return -1;
        if (RecordCodec.crc32(payload.array()) != h.crc()) return -1;
        return pos + RecordCodec.HEADER_BYTES + h.length();
    }

    private static byte[] validate(ByteBuffer full) {
        full.flip();
        RecordCodec.Header h = RecordCodec.readHeader(full);
        if (h == null || h.length() != full.remaining()) return null;
        byte[] payload = new byte[h.length()];
        full.get(payload);
        return RecordCodec.crc32(payload) == h.crc() ? payload : null;
    }

    /**
     * Sequential reader used during recovery. Reads through the segment
     * channels owned by the WAL, so closing it releases nothing.
     */
    private static final class Reader implements WalReader {
        private final Iterator<Map.Entry<Integer, FileChannel>> it;
        private Map.Entry<Integer, FileChannel> seg;
        private long pos;
        private long logicalBase;

        Reader(List<Map.Entry<Integer, FileChannel>> segs) {
            this.it = segs.iterator();
            this.seg = it.hasNext() ? it.next() : null;
        }

        @Override
        public Entry next() {
            try {
                while (seg != null) {
                    FileChannel c = seg.getValue();
                    long end = nextRecordEnd(c, pos);
                    if (end >= 0) {
                        int len = (int) (end - pos - RecordCodec.HEADER_BYTES);
                        ByteBuffer payload = ByteBuffer.allocate(len);
                        c.read(payload, pos + RecordCodec.HEADER_BYTES);
                        var loc = new Location(seg.getKey(), pos + RecordCodec.HEADER_BYTES, len, logicalBase + end);
                        pos = end;
                        return new Entry(payload.array(), loc);
                    }
                    if (pos < c.size()) {
                        log.log(Level.WARNING, "corrupt record in WAL segment {0} at {1}; skipping rest of segment",
                                new Object[]{seg.getKey(), pos});
                    }
                    logicalBase += c.size();
                    pos = 0;
                    seg = it.hasNext() ? it.next() : null;
                }
                return null;
            } catch (IOException e) {
                throw new ChunkStoreException("WAL replay failed", e);
            }
        }

        @Override
        public void close() {
            // channels belong to the WAL
        }
    }
}
