package ch.so.agi.gretlreclass.vector;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import com.linuxense.javadbf.DBFDataType;
import com.linuxense.javadbf.DBFException;
import com.linuxense.javadbf.DBFField;
import com.linuxense.javadbf.DBFReader;
import com.linuxense.javadbf.DBFWriter;

import ch.so.agi.gretlreclass.model.AreaOfInterest;
import ch.so.agi.gretlreclass.utils.AtomicFiles;
import ch.so.agi.gretlreclass.utils.SourceValues;

/**
 * ESRI Shapefile whose {@code .dbf} attribute table is read with javadbf.
 * The geometry components ({@code .shp}, {@code .shx}) and all other sidecar
 * files are copied byte for byte, only the {@code .dbf} is rewritten. A table
 * restricted to an area of interest writes {@code .shp} and {@code .shx}
 * anew with the selected records only.
 * <p>
 * Records flagged as deleted in the {@code .dbf} keep their place, so record
 * {@code n} always belongs to shape {@code n}. They read as missing values and
 * stay flagged in the output.
 * </p>
 */
public class ShapefileTable implements AttributeTable {

    /** Longest column name a dBASE header can store. */
    public static final int MAX_COLUMN_NAME = 10;
    static final int CODE_FIELD_LENGTH = 11;
    private static final byte DELETED = '*';

    private final Path path;
    private final DBFField[] fields;
    private final List<Object[]> records;
    private final boolean[] deleted;
    private final Charset charset;
    private final ShapeIndex shapes;
    private final int[] selection;

    private ShapefileTable(Path path, DBFField[] fields, List<Object[]> records, boolean[] deleted, Charset charset,
            ShapeIndex shapes, int[] selection) {
        this.path = path;
        this.fields = fields;
        this.records = records;
        this.deleted = deleted;
        this.charset = charset;
        this.shapes = shapes;
        this.selection = selection;
    }

    public static ShapefileTable load(Path shp) throws IOException {
        Path dbf = component(shp, ".dbf");
        if (dbf == null) {
            throw new IOException("Shapefile has no .dbf attribute table: " + shp);
        }
        Charset charset = readCharset(shp);
        DBFReader reader = null;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(dbf))) {
            reader = new DBFReader(in, charset, true);
            DBFField[] fields = new DBFField[reader.getFieldCount()];
            for (int i = 0; i < fields.length; i++) {
                fields[i] = reader.getField(i);
            }
            List<Object[]> records = new ArrayList<>(reader.getRecordCount());
            Object[] record;
            while ((record = reader.nextRecord()) != null) {
                records.add(record);
            }
            return new ShapefileTable(shp, fields, records, readDeletionFlags(dbf, records.size()),
                    reader.getCharset(), null, null);
        } catch (DBFException e) {
            throw new IOException("Cannot read " + dbf + ": " + e.getMessage(), e);
        } finally {
            if (reader != null) {
                reader.close();
            }
        }
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public VectorFormat getFormat() {
        return VectorFormat.SHAPEFILE;
    }

    @Override
    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(fields.length);
        for (DBFField field : fields) {
            names.add(field.getName());
        }
        return names;
    }

    @Override
    public boolean hasColumn(String name) {
        return indexOf(name) >= 0;
    }

    private int indexOf(String name) {
        for (int i = 0; i < fields.length; i++) {
            if (fields[i].getName().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public int size() {
        return records.size();
    }

    @Override
    public List<Object> column(String name) {
        int index = indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("No column " + name + " in " + path);
        }
        List<Object> values = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            values.add(deleted[i] ? null : SourceValues.normalize(records.get(i)[index]));
        }
        return values;
    }

    @Override
    public boolean isDeleted(int record) {
        return deleted[record];
    }

    /**
     * Selects the records whose shape bounding box intersects the area. Null
     * shapes are never selected.
     *
     * @throws IOException if the {@code .shp} cannot be read or has another record count than the {@code .dbf}
     */
    @Override
    public ShapefileTable within(AreaOfInterest aoi) throws IOException {
        ShapeIndex index = shapes;
        if (index == null) {
            index = ShapeIndex.read(path);
            if (index.size() != records.size()) {
                throw new IOException(path + " has " + index.size() + " shapes but " + records.size()
                        + " attribute records");
            }
        }
        List<Object[]> kept = new ArrayList<>();
        List<Integer> keptShapes = new ArrayList<>();
        List<Boolean> keptDeleted = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            int shape = selection == null ? i : selection[i];
            if (aoi.intersects(index.envelope(shape))) {
                kept.add(records.get(i));
                keptShapes.add(shape);
                keptDeleted.add(deleted[i]);
            }
        }
        int[] subset = new int[keptShapes.size()];
        boolean[] flags = new boolean[subset.length];
        for (int i = 0; i < subset.length; i++) {
            subset[i] = keptShapes.get(i);
            flags[i] = keptDeleted.get(i);
        }
        return new ShapefileTable(path, fields, kept, flags, charset, index, subset);
    }

    /**
     * Writes all components into a staging directory next to the destination
     * and moves them into place once complete.
     */
    @Override
    public void writeWithColumn(Path destination, String column, int[] codes) throws IOException {
        if (codes.length != records.size()) {
            throw new IllegalArgumentException(codes.length + " codes for " + records.size() + " records");
        }
        if (column.length() > MAX_COLUMN_NAME) {
            throw new IllegalArgumentException("Shapefile column names are limited to " + MAX_COLUMN_NAME
                    + " characters: " + column);
        }
        String stem = stem(destination);
        Path staging = AtomicFiles.temporarySibling(destination);
        try {
            AtomicFiles.delete(staging);
            Files.createDirectories(staging);
            String sourceStem = stem(path);
            List<Path> staged = new ArrayList<>();
            boolean hasIndex = false;
            for (Path sidecar : siblings(path)) {
                String suffix = sidecar.getFileName().toString().substring(sourceStem.length())
                        .toLowerCase(Locale.ROOT);
                if (".dbf".equals(suffix)) {
                    continue;
                }
                if (selection != null && (".shp".equals(suffix) || ".shx".equals(suffix))) {
                    hasIndex |= ".shx".equals(suffix);
                    continue;
                }
                Path target = staging.resolve(stem + suffix);
                Files.copy(sidecar, target);
                staged.add(target);
            }
            if (selection != null) {
                Path shp = staging.resolve(stem + ".shp");
                Path shx = hasIndex ? staging.resolve(stem + ".shx") : null;
                shapes.writeSubset(selection, shp, shx);
                staged.add(shp);
                if (shx != null) {
                    staged.add(shx);
                }
            }
            Path dbf = staging.resolve(stem + ".dbf");
            writeDbf(dbf, column, codes);
            markDeleted(dbf, deleted);
            staged.add(dbf);
            for (Path file : staged) {
                AtomicFiles.commit(file, destination.resolveSibling(file.getFileName()));
            }
            AtomicFiles.delete(staging);
        } catch (IOException | RuntimeException e) {
            AtomicFiles.discard(staging, e);
            throw e;
        }
    }

    private void writeDbf(Path dbf, String column, int[] codes) throws IOException {
        DBFField[] outFields = Arrays.copyOf(fields, fields.length + 1);
        DBFField codeField = new DBFField(column, DBFDataType.NUMERIC, CODE_FIELD_LENGTH, 0);
        outFields[fields.length] = codeField;
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(dbf))) {
            DBFWriter writer = new DBFWriter(out, charset);
            try {
                writer.setFields(outFields);
                for (int i = 0; i < records.size(); i++) {
                    Object[] record = records.get(i);
                    Object[] row = Arrays.copyOf(record, outFields.length);
                    row[fields.length] = codes[i];
                    writer.addRecord(row);
                }
            } finally {
                writer.close();
            }
        } catch (DBFException e) {
            throw new IOException("Cannot write " + dbf + ": " + e.getMessage(), e);
        }
    }

    private static boolean[] readDeletionFlags(Path dbf, int count) throws IOException {
        boolean[] flags = new boolean[count];
        try (RandomAccessFile file = new RandomAccessFile(dbf.toFile(), "r")) {
            int[] layout = recordLayout(file);
            for (int i = 0; i < count; i++) {
                file.seek(layout[0] + (long) i * layout[1]);
                flags[i] = file.read() == DELETED;
            }
        }
        return flags;
    }

    private static void markDeleted(Path dbf, boolean[] flags) throws IOException {
        try (RandomAccessFile file = new RandomAccessFile(dbf.toFile(), "rw")) {
            int[] layout = recordLayout(file);
            for (int i = 0; i < flags.length; i++) {
                if (flags[i]) {
                    file.seek(layout[0] + (long) i * layout[1]);
                    file.write(DELETED);
                }
            }
        }
    }

    /**
     * @return header length and record length of a dBASE file
     */
    private static int[] recordLayout(RandomAccessFile dbf) throws IOException {
        byte[] head = new byte[12];
        dbf.seek(0);
        dbf.readFully(head);
        ByteBuffer little = ByteBuffer.wrap(head).order(ByteOrder.LITTLE_ENDIAN);
        return new int[] {little.getShort(8) & 0xFFFF, little.getShort(10) & 0xFFFF};
    }

    private static Charset readCharset(Path shp) throws IOException {
        Path cpg = component(shp, ".cpg");
        if (cpg == null) {
            return null;
        }
        String name = Files.readString(cpg, Charset.forName("US-ASCII")).trim();
        if (name.isEmpty() || !Charset.isSupported(name)) {
            return null;
        }
        return Charset.forName(name);
    }

    /**
     * @return the component of the shapefile with the given extension, matched case-insensitively
     */
    static Path component(Path shp, String extension) throws IOException {
        for (Path sibling : siblings(shp)) {
            if (extensionOf(sibling).equals(extension)) {
                return sibling;
            }
        }
        return null;
    }

    /**
     * @return all files sharing the stem of the shapefile, the {@code .shp} itself
     *         and metadata such as {@code <stem>.shp.xml} included
     */
    static List<Path> siblings(Path shp) throws IOException {
        String stem = stem(shp);
        Path dir = shp.toAbsolutePath().getParent();
        List<Path> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(Files::isRegularFile)
                    .filter(p -> isComponent(p, stem))
                    .sorted()
                    .forEach(out::add);
        }
        return out;
    }

    private static boolean isComponent(Path file, String stem) {
        String name = file.getFileName().toString();
        if (stem(file).equals(stem)) {
            return !extensionOf(file).isEmpty();
        }
        return name.startsWith(stem + ".")
                && name.substring(stem.length()).toLowerCase(Locale.ROOT).startsWith(".shp.");
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }
}
