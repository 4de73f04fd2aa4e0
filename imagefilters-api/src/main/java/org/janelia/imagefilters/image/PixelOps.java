package org.janelia.imagefilters.image;

import net.imglib2.type.numeric.ARGBType;

/**
 * Packed RGB helpers. All colors are stored as ARGB ints with an opaque alpha.
 */
public class PixelOps {

    public static final int MAX_CHANNEL_VALUE = 255;

    public static int rgb(int r, int g, int b) {
        return ARGBType.rgba(clamp(r), clamp(g), clamp(b), MAX_CHANNEL_VALUE);
    }

    public static int rgb(double r, double g, double b) {
        return ARGBType.rgba(clamp(r), clamp(g), clamp(b), MAX_CHANNEL_VALUE);
    }

    public static int red(int rgb) {
        return ARGBType.red(rgb);
    }

    public static int green(int rgb) {
        return ARGBType.green(rgb);
    }

    public static int blue(int rgb) {
        return ARGBType.blue(rgb);
    }

    public static int clamp(int v) {
        if (v < 0) {
            return 0;
        } else if (v > MAX_CHANNEL_VALUE) {
            return MAX_CHANNEL_VALUE;
        } else {
            return v;
        }
    }

    /**
     * Saturate a real channel value to [0, 255] and round it to the nearest integer.
     */
    public static int clamp(double v) {
        if (v <= 0 || Double.isNaN(v)) {
            return 0;
        } else if (v >= MAX_CHANNEL_VALUE) {
            return MAX_CHANNEL_VALUE;
        } else {
            return (int) Math.round(v);
        }
    }

    public static int clampCoord(int v, int max) {
        if (v < 0) {
            return 0;
        } else if (v > max) {
            return max;
        } else {
            return v;
        }
    }

    /**
     * Luminance computed with the Rec. 601 weights.
     */
    public static double intensity(int r, int g, int b) {
        return 0.299 * r + 0.587 * g + 0.114 * b;
    }

    public static double intensity(int rgb) {
        return intensity(red(rgb), green(rgb), blue(rgb));
    }

}
