package org.janelia.imagefilters.filters;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.janelia.imagefilters.image.WavesTransform;

public class WavesFilter extends GeomTransformFilter {

    public static final float DEFAULT_SIGMA = 30.f;

    public WavesFilter() {
        this(DEFAULT_SIGMA, WavesTransform.WavesAxis.X);
    }

    public WavesFilter(float sigma, WavesTransform.WavesAxis axis) {
        super(new WavesTransform(sigma, axis));
    }

    public Img<ARGBType> process(RandomAccessibleInterval<ARGBType> img, float sigma, WavesTransform.WavesAxis axis) {
        return new WavesFilter(sigma, axis).process(img);
    }
}
