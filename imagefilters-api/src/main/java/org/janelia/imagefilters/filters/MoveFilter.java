package org.janelia.imagefilters.filters;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.janelia.imagefilters.image.ShiftTransform;

public class MoveFilter extends GeomTransformFilter {

    public MoveFilter(int deltaX, int deltaY) {
        super(new ShiftTransform(deltaX, deltaY));
    }

    /**
     * Move the image by the given deltas instead of the configured ones.
     */
    public Img<ARGBType> process(RandomAccessibleInterval<ARGBType> img, int deltaX, int deltaY) {
        return new MoveFilter(deltaX, deltaY).process(img);
    }
}
