package ch.so.agi.gretlreclass.vector;

import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.locationtech.jts.geom.Envelope;

/**
 * Record offsets and bounding boxes of a {@code .shp} file, read by scanning
 * the record headers. Shape content is never decoded beyond its bounding box.
 */
final class ShapeIndex {

    static final int HEADER_LENGTH = 100;
    private static final int FILE_CODE = 9994;
    private static final int RECORD_HEADER_LENGTH = 8;

    private final Path shp;
    private final byte[] header;
    private final long[] offsets;
    private final int[] contentLengths;
    private final Envelope[] envelopes;

    private ShapeIndex(Path shp, byte[] header, long[] offsets, int[] contentLengths, Envelope[] envelopes) {
        this.shp = shp;
        this.header = header;
        this.offsets = offsets;
        this.contentLengths = contentLengths;
        this.envelopes = envelopes;
    }

    static ShapeIndex read(Path shp) throws IOException {
        try (RandomAccessFile file = new RandomAccessFile(shp.toFile(), "r")) {
            byte[] header = new byte[HEADER_LENGTH];
            file.readFully(header);
            ByteBuffer big = ByteBuffer.wrap(header);
            if (big.getInt(0) != FILE_CODE) {
                throw new IOException("Not an ESRI shapefile: " + shp);
            }
            long end = Math.min(file.length(), 2L * big.getInt(24));
            List<Long> offsets = new ArrayList<>();
            List<Integer> lengths = new ArrayList<>();
            List<Envelope> envelopes = new ArrayList<>();
            long pos = HEADER_LENGTH;
            while (pos + RECORD_HEADER_LENGTH <= end) {
                file.seek(pos);
                file.readInt();
                int contentLength = 2 * file.readInt();
                if (contentLength < 4 || pos + RECORD_HEADER_LENGTH + contentLength > end) {
                    throw new IOException("Corrupt record " + (offsets.size() + 1) + " in " + shp);
                }
                byte[] content = new byte[Math.min(contentLength, 36)];
                file.readFully(content);
                offsets.add(pos);
                lengths.add(contentLength);
                envelopes.add(envelope(content, shp, offsets.size()));
                pos += RECORD_HEADER_LENGTH + contentLength;
            }
            long[] o = new long[offsets.size()];
            int[] l = new int[lengths.size()];
            for (int i = 0; i < o.length; i++) {
                o[i] = offsets.get(i);
                l[i] = lengths.get(i);
            }
            return new ShapeIndex(shp, header, o, l, envelopes.toArray(new Envelope[0]));
        } catch (EOFException e) {
            throw new IOException("Truncated shapefile " + shp, e);
        }
    }

    private static Envelope envelope(byte[] content, Path shp, int recordNumber) throws IOException {
        ByteBuffer little = ByteBuffer.wrap(content).order(ByteOrder.LITTLE_ENDIAN);
        if (content.length < 4) {
            throw new IOException("Record " + recordNumber + " of " + shp + " has no shape type");
        }
        int type = little.getInt(0);
        switch (type) {
        case 0:
            return null;
        case 1:
        case 11:
        case 21:
            if (content.length < 20) {
                throw new IOException("Point record " + recordNumber + " of " + shp + " is too short");
            }
            double x = little.getDouble(4);
            double y = little.getDouble(12);
            return new Envelope(x, x, y, y);
        default:
            if (content.length < 36) {
                throw new IOException("Record " + recordNumber + " of " + shp + " is too short");
            }
            return new Envelope(little.getDouble(4), little.getDouble(20), little.getDouble(12),
                    little.getDouble(28));
        }
    }

    int size() {
        return offsets.length;
    }

    /**
     * @return bounding box of the shape, {@code null} for a null shape
     */
    Envelope envelope(int record) {
        return envelopes[record];
    }

    /**
     * Writes a {@code .shp} holding the given records, renumbered from 1, and
     * the matching {@code .shx}. Header length and bounding box are recomputed.
     *
     * @param shx index file to write, {@code null} to skip it
     */
    void writeSubset(int[] records, Path out, Path shx) throws IOException {
        Envelope bounds = new Envelope();
        long length = HEADER_LENGTH;
        for (int record : records) {
            if (envelopes[record] != null) {
                bounds.expandToInclude(envelopes[record]);
            }
            length += RECORD_HEADER_LENGTH + contentLengths[record];
        }
        try (RandomAccessFile source = new RandomAccessFile(shp.toFile(), "r");
                RandomAccessFile target = new RandomAccessFile(out.toFile(), "rw")) {
            target.setLength(0);
            target.write(header(length, bounds));
            int number = 1;
            for (int record : records) {
                byte[] content = new byte[contentLengths[record]];
                source.seek(offsets[record] + RECORD_HEADER_LENGTH);
                source.readFully(content);
                target.writeInt(number++);
                target.writeInt(content.length / 2);
                target.write(content);
            }
        }
        if (shx == null) {
            return;
        }
        try (RandomAccessFile index = new RandomAccessFile(shx.toFile(), "rw")) {
            index.setLength(0);
            index.write(header(HEADER_LENGTH + (long) RECORD_HEADER_LENGTH * records.length, bounds));
            long offset = HEADER_LENGTH;
            for (int record : records) {
                index.writeInt((int) (offset / 2));
                index.writeInt(contentLengths[record] / 2);
                offset += RECORD_HEADER_LENGTH + contentLengths[record];
            }
        }
    }

    private byte[] header(long fileLength, Envelope bounds) {
        byte[] copy = header.clone();
        ByteBuffer.wrap(copy).putInt(24, (int) (fileLength / 2));
        ByteBuffer little = ByteBuffer.wrap(copy).order(ByteOrder.LITTLE_ENDIAN);
        boolean empty = bounds.isNull();
        little.putDouble(36, empty ? 0 : bounds.getMinX());
        little.putDouble(44, empty ? 0 : bounds.getMinY());
        little.putDouble(52, empty ? 0 : bounds.getMaxX());
        little.putDouble(60, empty ? 0 : bounds.getMaxY());
        return copy;
    }
}
