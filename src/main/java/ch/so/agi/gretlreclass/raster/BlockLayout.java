package ch.so.agi.gretlreclass.raster;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;

import ch.so.agi.gretlreclass.ReclassifySettings;

/**
 * Partition of a raster into non-overlapping blocks that follow the storage
 * layout of the source.
 * <p>
 * Tiled sources are processed tile by tile as long as a tile is a valid output
 * tile (multiple of 16 on both axes) and fits the pixel cap. Everything else is
 * processed in full-width strips: a multiple of the source strip height close
 * to the configured block height, never more rows than the pixel cap allows.
 * A layout may cover a window of the source; its blocks are then relative to
 * the window origin, and tiles are only kept when the window starts on a tile
 * boundary.
 * </p>
 */
public final class BlockLayout {

    private static final int TILE_ALIGNMENT = 16;

    private final int width;
    private final int height;
    private final int blockWidth;
    private final int blockHeight;
    private final boolean tiled;

    BlockLayout(int width, int height, int blockWidth, int blockHeight, boolean tiled) {
        this.width = width;
        this.height = height;
        this.blockWidth = blockWidth;
        this.blockHeight = blockHeight;
        this.tiled = tiled;
    }

    /**
     * @param window part of the source to cover, see {@link GeoTiffSource#window}
     */
    public static BlockLayout of(GeoTiffSource source, Rectangle window, ReclassifySettings settings) {
        boolean tiled = source.isTiled() && window.x % source.getTileWidth() == 0
                && window.y % source.getTileHeight() == 0;
        int rowsPerStrip = source.isTiled() ? window.height : source.getRowsPerStrip();
        return of(window.width, window.height, tiled, source.getTileWidth(), source.getTileHeight(), rowsPerStrip,
                settings.getBlockHeight(), settings.getBlockMaxPixels());
    }

    static BlockLayout of(int width, int height, boolean tiled, int tileWidth, int tileHeight, int rowsPerStrip,
            int fallbackHeight, long maxPixels) {
        if (tiled && tileWidth % TILE_ALIGNMENT == 0 && tileHeight % TILE_ALIGNMENT == 0
                && (long) tileWidth * tileHeight <= maxPixels) {
            return new BlockLayout(width, height, tileWidth, tileHeight, true);
        }
        int rows;
        if (!tiled && rowsPerStrip < height) {
            rows = Math.max(rowsPerStrip, (fallbackHeight / rowsPerStrip) * rowsPerStrip);
        } else {
            rows = fallbackHeight;
        }
        long maxRows = Math.max(1, maxPixels / Math.max(1, width));
        rows = (int) Math.min(rows, maxRows);
        rows = Math.min(rows, height);
        return new BlockLayout(width, height, width, Math.max(1, rows), false);
    }

    public int getBlockWidth() {
        return blockWidth;
    }

    public int getBlockHeight() {
        return blockHeight;
    }

    /**
     * @return {@code true} if blocks are tiles, {@code false} for full-width strips
     */
    public boolean isTiled() {
        return tiled;
    }

    public int getNumXBlocks() {
        return (width + blockWidth - 1) / blockWidth;
    }

    public int getNumYBlocks() {
        return (height + blockHeight - 1) / blockHeight;
    }

    public int getBlockCount() {
        return getNumXBlocks() * getNumYBlocks();
    }

    /**
     * Block at the given block grid position, clipped to the raster.
     */
    public Rectangle block(int bx, int by) {
        int x = bx * blockWidth;
        int y = by * blockHeight;
        return new Rectangle(x, y, Math.min(blockWidth, width - x), Math.min(blockHeight, height - y));
    }

    /**
     * @return all blocks in row-major order
     */
    public List<Rectangle> blocks() {
        List<Rectangle> blocks = new ArrayList<>(getBlockCount());
        for (int by = 0; by < getNumYBlocks(); by++) {
            for (int bx = 0; bx < getNumXBlocks(); bx++) {
                blocks.add(block(bx, by));
            }
        }
        return blocks;
    }

    @Override
    public String toString() {
        return (tiled ? "tiles " : "strips ") + blockWidth + "x" + blockHeight + " (" + getBlockCount() + " blocks)";
    }
}
