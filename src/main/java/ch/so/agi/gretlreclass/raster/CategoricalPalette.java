package ch.so.agi.gretlreclass.raster;

import java.awt.image.IndexColorModel;

import ch.so.agi.gretlreclass.model.ClassEntry;
import ch.so.agi.gretlreclass.model.ClassTable;

/**
 * 256 entry color table built from a {@link ClassTable}. Codes without a class
 * keep the format default (black).
 */
public final class CategoricalPalette {

    private final byte[] red = new byte[PixelLookup.MAX_CODE + 1];
    private final byte[] green = new byte[PixelLookup.MAX_CODE + 1];
    private final byte[] blue = new byte[PixelLookup.MAX_CODE + 1];

    private CategoricalPalette() {}

    /**
     * @throws ch.so.agi.gretlreclass.utils.ClassCodeRangeException if a class code does not fit into a byte
     */
    public static CategoricalPalette of(ClassTable classTable, String sourceId) {
        CategoricalPalette palette = new CategoricalPalette();
        for (ClassEntry entry : classTable.getEntries()) {
            PixelLookup.requireByte(entry.getCode(), "Class code", sourceId);
            palette.red[entry.getCode()] = (byte) entry.getRed();
            palette.green[entry.getCode()] = (byte) entry.getGreen();
            palette.blue[entry.getCode()] = (byte) entry.getBlue();
        }
        return palette;
    }

    public IndexColorModel toColorModel() {
        return new IndexColorModel(8, PixelLookup.MAX_CODE + 1, red, green, blue);
    }

    /**
     * @return packed {@code 0xRRGGBB} of the code
     */
    public int rgb(int code) {
        return (red[code] & 0xff) << 16 | (green[code] & 0xff) << 8 | (blue[code] & 0xff);
    }
}
