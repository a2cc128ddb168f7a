package ch.so.agi.gretlreclass.model;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.csvreader.CsvReader;
import com.csvreader.CsvWriter;

import ch.so.agi.gretlreclass.utils.ReclassifyException;
import ch.so.agi.gretlreclass.utils.SourceValues;
import ch.so.agi.gretlreclass.utils.Stage;

/**
 * Persistence of a {@link ReclassMatrix} as a delimited text file with one row
 * per destination bucket: {@code destination_code,source_value_1,source_value_2,...}.
 * Rows have variable width; a row holding only the code is an empty bucket.
 */
public final class MatrixFile {

    private MatrixFile() {}

    public static ReclassMatrix load(Path file) throws IOException {
        return load(file, ReclassMatrix.DEFAULT_VALUE);
    }

    /**
     * Reads a matrix. Members are appended raw, so a value listed in two rows
     * is kept twice and reported by validation.
     *
     * @param file         matrix file
     * @param defaultValue fallback for unmapped source values
     */
    public static ReclassMatrix load(Path file, int defaultValue) throws IOException {
        ReclassMatrix.Builder builder = ReclassMatrix.builder().defaultValue(defaultValue);
        try (InputStream in = Files.newInputStream(file)) {
            CsvReader reader = new CsvReader(in, ',', StandardCharsets.UTF_8);
            try {
                reader.setSkipEmptyRecords(true);
                int row = 0;
                while (reader.readRecord()) {
                    row++;
                    String[] values = reader.getValues();
                    if (values.length == 0 || values[0].isBlank()) {
                        continue;
                    }
                    int code;
                    try {
                        code = Integer.parseInt(values[0].trim());
                    } catch (NumberFormatException e) {
                        throw new ReclassifyException(file.toString(), Stage.VALIDATE,
                                "Row " + row + ": destination code is not an integer: " + values[0], e);
                    }
                    List<String> members = new ArrayList<>();
                    for (int i = 1; i < values.length; i++) {
                        if (!values[i].isBlank()) {
                            members.add(values[i]);
                        }
                    }
                    builder.put(code, members);
                }
            } finally {
                reader.close();
            }
        }
        return builder.build();
    }

    /**
     * Writes the buckets in their authoring order, members sorted.
     */
    public static void save(ReclassMatrix matrix, Path file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            CsvWriter writer = new CsvWriter(out, ',', StandardCharsets.UTF_8);
            try {
                for (Map.Entry<Integer, Set<Object>> bucket : matrix.getBuckets().entrySet()) {
                    List<Object> members = SourceValues.sorted(bucket.getValue());
                    String[] row = new String[members.size() + 1];
                    row[0] = Integer.toString(bucket.getKey());
                    for (int i = 0; i < members.size(); i++) {
                        row[i + 1] = String.valueOf(members.get(i));
                    }
                    writer.writeRecord(row);
                }
            } finally {
                writer.close();
            }
        }
    }
}
