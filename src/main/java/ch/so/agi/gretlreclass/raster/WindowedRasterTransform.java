package ch.so.agi.gretlreclass.raster;

import java.awt.Rectangle;
import java.awt.image.IndexColorModel;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.stream.ImageOutputStream;

import ch.so.agi.gretlreclass.ReclassifySettings;
import ch.so.agi.gretlreclass.logging.LogEnvironment;
import ch.so.agi.gretlreclass.logging.ReclassLogger;
import ch.so.agi.gretlreclass.model.AreaOfInterest;
import ch.so.agi.gretlreclass.model.ClassTable;
import ch.so.agi.gretlreclass.model.ReclassMatrix;
import ch.so.agi.gretlreclass.utils.AtomicFiles;
import ch.so.agi.gretlreclass.utils.ReclassifyCancelledException;
import ch.so.agi.gretlreclass.utils.ReclassifyException;
import ch.so.agi.gretlreclass.utils.Stage;

/**
 * Remaps one band of a GeoTIFF into a new single band, unsigned 8-bit GeoTIFF
 * with a categorical color table, holding at most one block of pixels in
 * memory.
 * <p>
 * The output keeps the dimensions and georeferencing of the source, or of the
 * pixel window covering an area of interest when one is given. It is
 * written to {@code <destination>.tmp} and renamed into place after the last
 * block; on failure or cancellation the temporary file is removed and the
 * destination is left untouched. An instance runs one transform at a time.
 * </p>
 */
public class WindowedRasterTransform {

    private final ReclassLogger log;
    private final ReclassifySettings settings;

    private TransformState state;
    private TransformState failedIn;
    private int blocksDone;
    private int blockCount;

    public WindowedRasterTransform(ReclassifySettings settings) {
        this.settings = settings;
        this.log = LogEnvironment.getLogger(this.getClass());
    }

    public TransformState getState() {
        return state;
    }

    /**
     * @return the state a failed run was in, {@code null} unless {@link #getState()} is {@link TransformState#FAILED}
     */
    public TransformState getFailedState() {
        return failedIn;
    }

    public TransformReport run(Path sourcePath, int band, ReclassMatrix matrix, ClassTable classTable,
            Path destination, RasterProgress progress) {
        return run(sourcePath, band, null, matrix, classTable, destination, progress);
    }

    /**
     * @param sourcePath  source raster
     * @param band        zero-based band index
     * @param aoi         area the output is cut to, {@code null} for the whole raster
     * @param destination output GeoTIFF, replaced on success
     * @throws ReclassifyException validation errors before anything is written, I/O errors with cleanup
     */
    public synchronized TransformReport run(Path sourcePath, int band, AreaOfInterest aoi, ReclassMatrix matrix,
            ClassTable classTable, Path destination, RasterProgress progress) {
        String sourceId = sourcePath.toString();
        state = null;
        failedIn = null;
        blocksDone = 0;

        PixelLookup lookup = PixelLookup.of(matrix, sourceId);
        IndexColorModel colorModel = CategoricalPalette.of(classTable, sourceId).toColorModel();
        Set<Integer> uncolored = new TreeSet<>(matrix.destinationCodes());
        uncolored.removeAll(classTable.codes());
        if (!uncolored.isEmpty()) {
            log.warn("Class codes " + uncolored + " of " + sourceId + " have no class table entry and are drawn black");
        }

        GeoTiffSource source;
        try {
            source = GeoTiffSource.open(sourcePath);
        } catch (IOException e) {
            throw new ReclassifyException(sourceId, Stage.TRANSFORM, "Cannot open raster: " + e.getMessage(), e);
        }
        Path temporary = AtomicFiles.temporarySibling(destination);
        try (GeoTiffSource src = source) {
            src.requireCategoricalBand(band);
            Rectangle window = src.window(aoi);
            state = TransformState.OPENED;
            BlockLayout layout = BlockLayout.of(src, window, settings);
            blockCount = layout.getBlockCount();
            log.info("Remapping " + window.width + "x" + window.height + " pixels at " + window.x + "," + window.y
                    + " of band " + (band + 1) + " in " + layout);
            progress.started(blockCount);

            ReclassifiedImage image = new ReclassifiedImage(src, window, band, lookup, colorModel, layout,
                    new ProgressObserver(progress));
            write(src.getGeoFields(window), image, layout, temporary);

            state = TransformState.COMMITTING;
            AtomicFiles.commit(temporary, destination);
            long bytes = Files.size(destination);
            state = TransformState.DONE;
            log.debug("Committed " + destination + " (" + bytes + " bytes)");
            return new TransformReport(destination, layout, blocksDone, image.getMaxBufferPixels(),
                    image.getHistogram(), bytes);
        } catch (PartialWriteException e) {
            fail(e.getState(), temporary, e);
            Throwable cause = e.getCause();
            if (cause instanceof ReclassifyException) {
                throw ((ReclassifyException) cause).withContext(sourceId, Stage.TRANSFORM);
            }
            throw new ReclassifyException(sourceId, Stage.TRANSFORM,
                    "Writing " + destination + " failed: " + cause.getMessage(), cause);
        } catch (IOException e) {
            fail(state, temporary, e);
            Stage stage = failedIn == TransformState.COMMITTING ? Stage.COMMIT : Stage.TRANSFORM;
            throw new ReclassifyException(sourceId, stage, "Cannot write " + destination + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            fail(state, temporary, e);
            throw e;
        }
    }

    private void fail(TransformState in, Path temporary, Throwable error) {
        failedIn = in;
        state = TransformState.FAILED;
        AtomicFiles.discard(temporary, error);
    }

    private void write(List<TIFFField> geoFields, ReclassifiedImage image, BlockLayout layout, Path temporary)
            throws IOException, PartialWriteException {
        Path parent = temporary.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.deleteIfExists(temporary);

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("TIFF");
        if (!writers.hasNext()) {
            throw new IOException("No TIFF image writer available");
        }
        ImageWriter writer = writers.next();
        try (ImageOutputStream out = ImageIO.createImageOutputStream(temporary.toFile())) {
            writer.setOutput(out);
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (layout.isTiled()) {
                param.setTilingMode(ImageWriteParam.MODE_EXPLICIT);
                param.setTiling(layout.getBlockWidth(), layout.getBlockHeight(), 0, 0);
            }
            String compression = settings.getCompression();
            if (compression != null) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionType(compression);
            }
            IIOMetadata metadata = metadata(writer, param, image, geoFields, layout);
            writer.write(null, new IIOImage(image, null, metadata), param);
            state = TransformState.COLORING;
            out.flush();
        } catch (UncheckedIOException e) {
            throw new PartialWriteException(state, e.getCause());
        } catch (ReclassifyException e) {
            throw new PartialWriteException(state, e);
        } catch (IOException e) {
            if (state == TransformState.OPENED) {
                throw e;
            }
            throw new PartialWriteException(state, e);
        } finally {
            writer.dispose();
        }
    }

    private static IIOMetadata metadata(ImageWriter writer, ImageWriteParam param, ReclassifiedImage image,
            List<TIFFField> geoFields, BlockLayout layout) throws IOException {
        IIOMetadata defaults = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image),
                param);
        TIFFDirectory dir;
        try {
            dir = TIFFDirectory.createFromMetadata(defaults);
        } catch (IIOInvalidTreeException e) {
            throw new IOException("Cannot prepare TIFF directory", e);
        }
        for (TIFFField field : geoFields) {
            dir.addTIFFField(field);
        }
        if (!layout.isTiled()) {
            dir.addTIFFField(new TIFFField(
                    BaselineTIFFTagSet.getInstance().getTag(BaselineTIFFTagSet.TAG_ROWS_PER_STRIP),
                    layout.getBlockHeight()));
        }
        return dir.getAsMetadata();
    }

    private final class ProgressObserver implements ReclassifiedImage.BlockObserver {
        private final RasterProgress progress;

        ProgressObserver(RasterProgress progress) {
            this.progress = progress;
        }

        @Override
        public void beforeBlock(Rectangle region) {
            if (progress.isCanceled()) {
                throw new ReclassifyCancelledException(null, Stage.TRANSFORM,
                        "Cancelled after " + blocksDone + " of " + blockCount + " blocks");
            }
            state = TransformState.READING;
        }

        @Override
        public void afterBlock(Rectangle region) {
            state = TransformState.WRITING;
            blocksDone++;
            if (log.isDebugEnabled()) {
                log.debug("Block " + blocksDone + "/" + blockCount + " " + region.x + "," + region.y + " "
                        + region.width + "x" + region.height);
            }
            progress.blockDone(blocksDone, blockCount);
            if (blocksDone >= blockCount) {
                state = TransformState.COLORING;
            }
        }
    }
}
