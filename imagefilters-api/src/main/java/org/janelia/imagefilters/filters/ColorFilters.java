package org.janelia.imagefilters.filters;

import org.janelia.imagefilters.image.PixelOps;

public class ColorFilters {

    public static final float DEFAULT_BRIGHTNESS_COEFFICIENT = 100.f;
    public static final float DEFAULT_SEPIA_COEFFICIENT = 15.f;

    public static ColorMapFilter invert() {
        return new ColorMapFilter(rgb -> PixelOps.rgb(
                PixelOps.MAX_CHANNEL_VALUE - PixelOps.red(rgb),
                PixelOps.MAX_CHANNEL_VALUE - PixelOps.green(rgb),
                PixelOps.MAX_CHANNEL_VALUE - PixelOps.blue(rgb)));
    }

    public static ColorMapFilter brightness(float coefficient) {
        return new ColorMapFilter(rgb -> PixelOps.rgb(
                PixelOps.red(rgb) + (double) coefficient,
                PixelOps.green(rgb) + (double) coefficient,
                PixelOps.blue(rgb) + (double) coefficient));
    }

    public static ColorMapFilter grayScale() {
        return new ColorMapFilter(rgb -> {
            double intensity = PixelOps.intensity(rgb);
            return PixelOps.rgb(intensity, intensity, intensity);
        });
    }

    public static ColorMapFilter sepia(float coefficient) {
        return new ColorMapFilter(rgb -> {
            double intensity = PixelOps.intensity(rgb);
            return PixelOps.rgb(
                    intensity + 2 * coefficient,
                    intensity + 0.5 * coefficient,
                    intensity - coefficient);
        });
    }
}
