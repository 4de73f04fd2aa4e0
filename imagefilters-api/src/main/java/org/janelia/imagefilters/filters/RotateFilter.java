package org.janelia.imagefilters.filters;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.janelia.imagefilters.image.RotateTransform;

public class RotateFilter extends GeomTransformFilter {

    /**
     * @param angle rotation angle in radians
     */
    public RotateFilter(int centerX, int centerY, double angle) {
        super(new RotateTransform(centerX, centerY, angle));
    }

    /**
     * Rotate around the given center by the given angle instead of the configured ones.
     */
    public Img<ARGBType> process(RandomAccessibleInterval<ARGBType> img, int centerX, int centerY, double angle) {
        return new RotateFilter(centerX, centerY, angle).process(img);
    }
}
