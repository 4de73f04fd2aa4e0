package org.janelia.imagefilters.filters;

import org.janelia.imagefilters.image.PixelOps;
import org.janelia.imagefilters.image.RGBPixelHistogram;

/**
 * White balance assuming that the average color of the scene is gray.
 */
public class GrayWorldFilter extends AbstractStatisticsFilter {

    @Override
    protected ImageFilter createPixelFilter(RGBPixelHistogram imageHistogram) {
        double[] means = imageHistogram.meanVals();
        double avg = (means[0] + means[1] + means[2]) / 3;
        return new ColorMapFilter(rgb -> PixelOps.rgb(
                scaleChannel(PixelOps.red(rgb), avg, means[0]),
                scaleChannel(PixelOps.green(rgb), avg, means[1]),
                scaleChannel(PixelOps.blue(rgb), avg, means[2])
        ));
    }
}
