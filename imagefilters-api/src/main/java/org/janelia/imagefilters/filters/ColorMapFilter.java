package org.janelia.imagefilters.filters;

import java.util.function.IntUnaryOperator;

import org.janelia.imagefilters.image.ClampedPixelAccess;

/**
 * Point filter: the output pixel only depends on the input pixel at the same position.
 */
public class ColorMapFilter extends AbstractPixelFilter {

    private final IntUnaryOperator colorMap;

    public ColorMapFilter(IntUnaryOperator colorMap) {
        this.colorMap = colorMap;
    }

    @Override
    protected int calcNewPixelColor(ClampedPixelAccess img, int x, int y) {
        return colorMap.applyAsInt(img.get(x, y));
    }
}
