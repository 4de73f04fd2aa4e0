package org.janelia.imagefilters.filters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.janelia.imagefilters.image.ClampedPixelAccess;
import org.janelia.imagefilters.image.ImageAccessUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filter that computes every output pixel independently from the input image.
 * Subclasses only provide {@link #calcNewPixelColor(ClampedPixelAccess, int, int)},
 * which must not depend on the order in which pixels are visited.
 */
public abstract class AbstractPixelFilter implements ImageFilter {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractPixelFilter.class);

    /**
     * @param img read access to the input image
     * @param x column of the output pixel
     * @param y row of the output pixel
     * @return the packed RGB value of the output pixel
     */
    protected abstract int calcNewPixelColor(ClampedPixelAccess img, int x, int y);

    @Override
    public Img<ARGBType> process(RandomAccessibleInterval<ARGBType> img) {
        long startTime = System.currentTimeMillis();
        Img<ARGBType> output = ImageAccessUtils.createRGBImage(img.dimension(0), img.dimension(1));
        processRows(img, output, 0, ImageAccessUtils.getHeight(img));
        LOG.debug("Applied {} to a {}x{} image in {}s",
                getClass().getSimpleName(), img.dimension(0), img.dimension(1),
                (System.currentTimeMillis() - startTime) / 1000.);
        return output;
    }

    /**
     * Process the image by splitting the rows into bands that run as separate tasks.
     */
    @Override
    public Img<ARGBType> process(RandomAccessibleInterval<ARGBType> img, ExecutorService executorService) {
        if (executorService == null) {
            return process(img);
        }
        long startTime = System.currentTimeMillis();
        int height = ImageAccessUtils.getHeight(img);
        Img<ARGBType> output = ImageAccessUtils.createRGBImage(img.dimension(0), img.dimension(1));
        int nbands = Math.max(1, Math.min(height, Runtime.getRuntime().availableProcessors() * 4));
        int bandHeight = (height + nbands - 1) / nbands;
        List<Callable<Void>> bandTasks = new ArrayList<>();
        for (int startRow = 0; startRow < height; startRow += bandHeight) {
            int fromRow = startRow;
            int toRow = Math.min(height, startRow + bandHeight);
            bandTasks.add(() -> {
                processRows(img, output, fromRow, toRow);
                return null;
            });
        }
        try {
            for (Future<Void> bandResult : executorService.invokeAll(bandTasks)) {
                bandResult.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException(e.getCause());
        }
        LOG.debug("Applied {} to a {}x{} image using {} tasks in {}s",
                getClass().getSimpleName(), img.dimension(0), img.dimension(1), bandTasks.size(),
                (System.currentTimeMillis() - startTime) / 1000.);
        return output;
    }

    private void processRows(RandomAccessibleInterval<ARGBType> img, Img<ARGBType> output, int fromRow, int toRow) {
        ClampedPixelAccess imgAccess = new ClampedPixelAccess(img);
        RandomAccess<ARGBType> outputAccess = output.randomAccess();
        int width = imgAccess.getWidth();
        for (int y = fromRow; y < toRow; y++) {
            outputAccess.setPosition(y, 1);
            for (int x = 0; x < width; x++) {
                outputAccess.setPosition(x, 0);
                outputAccess.get().set(calcNewPixelColor(imgAccess, x, y));
            }
        }
    }
}
