package org.janelia.imagefilters.filters;

import org.janelia.imagefilters.image.PixelOps;
import org.janelia.imagefilters.image.RGBPixelHistogram;

/**
 * White balance assuming that the brightest value of each channel is white.
 */
public class PerfectReflectorFilter extends AbstractStatisticsFilter {

    @Override
    protected ImageFilter createPixelFilter(RGBPixelHistogram imageHistogram) {
        int maxRGB = imageHistogram.maxVal();
        int maxR = PixelOps.red(maxRGB);
        int maxG = PixelOps.green(maxRGB);
        int maxB = PixelOps.blue(maxRGB);
        return new ColorMapFilter(rgb -> PixelOps.rgb(
                scaleChannel(PixelOps.red(rgb), PixelOps.MAX_CHANNEL_VALUE, maxR),
                scaleChannel(PixelOps.green(rgb), PixelOps.MAX_CHANNEL_VALUE, maxG),
                scaleChannel(PixelOps.blue(rgb), PixelOps.MAX_CHANNEL_VALUE, maxB)
        ));
    }
}
