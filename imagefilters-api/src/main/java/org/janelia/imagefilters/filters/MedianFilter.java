package org.janelia.imagefilters.filters;

import java.util.Arrays;

import org.janelia.imagefilters.image.ClampedPixelAccess;
import org.janelia.imagefilters.image.PixelOps;

/**
 * Per channel median of the square neighborhood.
 */
public class MedianFilter extends AbstractPixelFilter {

    public static final int DEFAULT_RADIUS = 2;

    private final int radius;

    public MedianFilter() {
        this(DEFAULT_RADIUS);
    }

    public MedianFilter(int radius) {
        if (radius <= 0) {
            throw new IllegalArgumentException("Median radius must be positive: " + radius);
        }
        this.radius = radius;
    }

    public int getRadius() {
        return radius;
    }

    @Override
    protected int calcNewPixelColor(ClampedPixelAccess img, int x, int y) {
        int side = 2 * radius + 1;
        int size = side * side;
        int[] reds = new int[size];
        int[] greens = new int[size];
        int[] blues = new int[size];
        int k = 0;
        for (int i = -radius; i <= radius; i++) {
            for (int j = -radius; j <= radius; j++, k++) {
                int rgb = img.get(x + j, y + i);
                reds[k] = PixelOps.red(rgb);
                greens[k] = PixelOps.green(rgb);
                blues[k] = PixelOps.blue(rgb);
            }
        }
        Arrays.sort(reds);
        Arrays.sort(greens);
        Arrays.sort(blues);
        return PixelOps.rgb(reds[size / 2], greens[size / 2], blues[size / 2]);
    }
}
