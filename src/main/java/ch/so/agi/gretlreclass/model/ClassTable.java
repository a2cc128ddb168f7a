package ch.so.agi.gretlreclass.model;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.csvreader.CsvReader;
import com.csvreader.CsvWriter;

import ch.so.agi.gretlreclass.utils.InvalidClassTableException;

/**
 * Ordered, immutable table of destination classes keyed by their unique code.
 * <p>
 * The text form is a headerless delimited file with one class per row:
 * {@code code,name[,color]}. A missing color defaults to black.
 * </p>
 */
public final class ClassTable {

    private final Map<Integer, ClassEntry> entries;

    private ClassTable(Map<Integer, ClassEntry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * @param entries the classes in display order
     * @return the table
     * @throws InvalidClassTableException if two entries share a code
     */
    public static ClassTable of(List<ClassEntry> entries) {
        Map<Integer, ClassEntry> map = new LinkedHashMap<>();
        for (ClassEntry entry : entries) {
            if (map.putIfAbsent(entry.getCode(), entry) != null) {
                throw new InvalidClassTableException("Duplicate class code " + entry.getCode());
            }
        }
        return new ClassTable(map);
    }

    public static ClassTable of(ClassEntry... entries) {
        return of(List.of(entries));
    }

    /**
     * Reads a class table file.
     *
     * @throws IOException                if the file cannot be read
     * @throws InvalidClassTableException if a row is malformed or codes repeat
     */
    public static ClassTable load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toString());
        }
    }

    static ClassTable read(InputStream in, String origin) throws IOException {
        List<ClassEntry> entries = new ArrayList<>();
        CsvReader reader = new CsvReader(in, ',', StandardCharsets.UTF_8);
        try {
            reader.setSkipEmptyRecords(true);
            int row = 0;
            while (reader.readRecord()) {
                row++;
                int columns = reader.getColumnCount();
                if (columns == 1 && reader.get(0).isBlank()) {
                    continue;
                }
                if (columns < 2 || columns > 3) {
                    throw new InvalidClassTableException(
                            origin + " row " + row + ": expected 2 or 3 columns but found " + columns);
                }
                int code;
                try {
                    code = Integer.parseInt(reader.get(0).trim());
                } catch (NumberFormatException e) {
                    throw new InvalidClassTableException(
                            origin + " row " + row + ": class code is not an integer: " + reader.get(0));
                }
                String color = columns == 3 ? reader.get(2) : null;
                entries.add(new ClassEntry(code, reader.get(1).trim(), color));
            }
        } finally {
            reader.close();
        }
        return of(entries);
    }

    /**
     * Writes the table in the three column text form accepted by {@link #load(Path)}.
     */
    public void save(Path file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            CsvWriter writer = new CsvWriter(out, ',', StandardCharsets.UTF_8);
            try {
                for (ClassEntry entry : entries.values()) {
                    writer.writeRecord(new String[] {
                            Integer.toString(entry.getCode()), entry.getName(), entry.getColor()});
                }
            } finally {
                writer.close();
            }
        }
    }

    /**
     * @throws InvalidClassTableException if the table has no entries and can therefore not be exported
     */
    public ClassTable requireUsable() {
        if (entries.isEmpty()) {
            throw new InvalidClassTableException("Class table must contain at least one class");
        }
        return this;
    }

    public List<ClassEntry> getEntries() {
        return List.copyOf(entries.values());
    }

    public ClassEntry get(int code) {
        return entries.get(code);
    }

    public boolean contains(int code) {
        return entries.containsKey(code);
    }

    public Set<Integer> codes() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassTable)) return false;
        return List.copyOf(entries.values()).equals(List.copyOf(((ClassTable) o).entries.values()));
    }

    @Override
    public int hashCode() {
        return List.copyOf(entries.values()).hashCode();
    }

    @Override
    public String toString() {
        return "ClassTable" + entries.values();
    }
}
