package org.janelia.imagefilters.filters;

import java.util.concurrent.ExecutorService;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.janelia.imagefilters.image.RGBPixelHistogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filter driven by image wide statistics. The statistics are gathered first
 * and then turned into a point filter that is applied to the same image;
 * nothing is kept between calls.
 */
public abstract class AbstractStatisticsFilter implements ImageFilter {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractStatisticsFilter.class);

    protected abstract ImageFilter createPixelFilter(RGBPixelHistogram imageHistogram);

    @Override
    public Img<ARGBType> process(RandomAccessibleInterval<ARGBType> img) {
        return prepare(img).process(img);
    }

    @Override
    public Img<ARGBType> process(RandomAccessibleInterval<ARGBType> img, ExecutorService executorService) {
        return prepare(img).process(img, executorService);
    }

    private ImageFilter prepare(RandomAccessibleInterval<ARGBType> img) {
        RGBPixelHistogram imageHistogram = RGBPixelHistogram.of(img);
        LOG.debug("{} image statistics: {}", getClass().getSimpleName(), imageHistogram);
        return createPixelFilter(imageHistogram);
    }

    static double scaleChannel(int value, double numerator, double denominator) {
        return denominator == 0 ? value : value * numerator / denominator;
    }
}
