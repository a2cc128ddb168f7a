package ch.so.agi.gretlreclass.vector;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import ch.so.agi.gretlreclass.model.AreaOfInterest;

/**
 * Attribute table of a local vector dataset, fully loaded into memory.
 * Geometries are carried along untouched.
 */
public interface AttributeTable {

    Path getPath();

    VectorFormat getFormat();

    /**
     * @return attribute column names in file order, geometry excluded
     */
    List<String> getColumnNames();

    boolean hasColumn(String name);

    int size();

    /**
     * @return the normalised value of the column for every record, {@code null} where it is missing
     */
    List<Object> column(String name);

    /**
     * @return {@code true} if the record is flagged as deleted; its values read as missing
     */
    default boolean isDeleted(int record) {
        return false;
    }

    /**
     * @return a table with the records whose geometry bounding box intersects the area, in record order
     */
    AttributeTable within(AreaOfInterest aoi) throws IOException;

    /**
     * Writes a copy of the dataset with one additional integer column.
     *
     * @param destination file in the same format, replaced on success
     * @param column      name of the added column
     * @param codes       value of the added column per record, in record order
     */
    void writeWithColumn(Path destination, String column, int[] codes) throws IOException;
}
