package org.janelia.imagefilters.filters;

import org.janelia.imagefilters.image.ClampedPixelAccess;
import org.janelia.imagefilters.image.GeomTransform;
import org.janelia.imagefilters.image.PixelOps;

/**
 * Each output pixel is read from the source position given by the transform;
 * positions outside of the image are black.
 */
public class GeomTransformFilter extends AbstractPixelFilter {

    private static final int BACKGROUND = PixelOps.rgb(0, 0, 0);

    private final GeomTransform geomTransform;

    public GeomTransformFilter(GeomTransform geomTransform) {
        this.geomTransform = geomTransform;
    }

    @Override
    protected int calcNewPixelColor(ClampedPixelAccess img, int x, int y) {
        long[] origin = new long[2];
        geomTransform.apply(new long[] {x, y}, origin);
        if (origin[0] < 0 || origin[0] >= img.getWidth() || origin[1] < 0 || origin[1] >= img.getHeight()) {
            return BACKGROUND;
        }
        return img.get((int) origin[0], (int) origin[1]);
    }
}
