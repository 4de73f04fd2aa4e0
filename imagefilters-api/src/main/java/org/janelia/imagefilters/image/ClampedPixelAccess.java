package org.janelia.imagefilters.image;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.ARGBType;

/**
 * Read access to an RGB image in zero-origin coordinates. Out of range
 * coordinates are replaced with the nearest edge pixel.
 *
 * Instances are not thread safe - each worker must create its own access.
 */
public class ClampedPixelAccess {

    private final RandomAccess<ARGBType> imageAccess;
    private final long minX;
    private final long minY;
    private final int width;
    private final int height;

    public ClampedPixelAccess(RandomAccessibleInterval<ARGBType> img) {
        this.imageAccess = img.randomAccess();
        this.minX = img.min(0);
        this.minY = img.min(1);
        this.width = (int) img.dimension(0);
        this.height = (int) img.dimension(1);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * @return the packed color at (x, y), with both coordinates clamped to the image bounds.
     */
    public int get(int x, int y) {
        imageAccess.setPosition(minX + PixelOps.clampCoord(x, width - 1), 0);
        imageAccess.setPosition(minY + PixelOps.clampCoord(y, height - 1), 1);
        return imageAccess.get().get();
    }
}
