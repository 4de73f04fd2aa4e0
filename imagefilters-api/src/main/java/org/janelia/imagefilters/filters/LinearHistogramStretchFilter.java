package org.janelia.imagefilters.filters;

import org.janelia.imagefilters.image.PixelOps;
import org.janelia.imagefilters.image.RGBPixelHistogram;

/**
 * Stretches each channel linearly so that its range covers [0, 255].
 */
public class LinearHistogramStretchFilter extends AbstractStatisticsFilter {

    @Override
    protected ImageFilter createPixelFilter(RGBPixelHistogram imageHistogram) {
        int minRGB = imageHistogram.minVal();
        int maxRGB = imageHistogram.maxVal();
        int minR = PixelOps.red(minRGB);
        int minG = PixelOps.green(minRGB);
        int minB = PixelOps.blue(minRGB);
        int deltaR = PixelOps.red(maxRGB) - minR;
        int deltaG = PixelOps.green(maxRGB) - minG;
        int deltaB = PixelOps.blue(maxRGB) - minB;
        return new ColorMapFilter(rgb -> PixelOps.rgb(
                stretch(PixelOps.red(rgb), minR, deltaR),
                stretch(PixelOps.green(rgb), minG, deltaG),
                stretch(PixelOps.blue(rgb), minB, deltaB)
        ));
    }

    private static double stretch(int value, int min, int delta) {
        // a flat channel cannot be stretched
        return delta == 0 ? value : (value - min) * (double) PixelOps.MAX_CHANNEL_VALUE / delta;
    }
}
