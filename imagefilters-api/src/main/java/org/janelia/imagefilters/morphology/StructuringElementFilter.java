package org.janelia.imagefilters.morphology;

import java.util.function.IntBinaryOperator;

import org.janelia.imagefilters.filters.AbstractPixelFilter;
import org.janelia.imagefilters.image.ClampedPixelAccess;
import org.janelia.imagefilters.image.PixelOps;
import org.janelia.imagefilters.kernel.Kernel;

/**
 * Rank style filter over a structuring element. Every non-zero kernel cell
 * marks a neighbor whose channel values are folded into a per channel
 * accumulator; zero cells are ignored.
 */
public class StructuringElementFilter extends AbstractPixelFilter {

    /**
     * Per channel maximum over the structuring element.
     */
    public static StructuringElementFilter dilation(Kernel structuringElement) {
        return new StructuringElementFilter(structuringElement, 0, Math::max);
    }

    /**
     * Per channel minimum over the structuring element.
     */
    public static StructuringElementFilter erosion(Kernel structuringElement) {
        return new StructuringElementFilter(structuringElement, PixelOps.MAX_CHANNEL_VALUE, Math::min);
    }

    private final Kernel structuringElement;
    private final int initialValue;
    private final IntBinaryOperator combineOp;

    /**
     * @param structuringElement kernel whose non-zero cells select the neighbors
     * @param initialValue accumulator value before any neighbor is combined
     * @param combineOp channel combine operation
     */
    public StructuringElementFilter(Kernel structuringElement, int initialValue, IntBinaryOperator combineOp) {
        if (structuringElement == null || combineOp == null) {
            throw new IllegalArgumentException("Both the structuring element and the combine operation are required");
        }
        this.structuringElement = structuringElement;
        this.initialValue = initialValue;
        this.combineOp = combineOp;
    }

    public Kernel getStructuringElement() {
        return structuringElement;
    }

    @Override
    protected int calcNewPixelColor(ClampedPixelAccess img, int x, int y) {
        int radius = structuringElement.getRadius();
        int r = initialValue;
        int g = initialValue;
        int b = initialValue;
        int k = 0;
        for (int i = -radius; i <= radius; i++) {
            for (int j = -radius; j <= radius; j++, k++) {
                if (structuringElement.getAt(k) == 0) {
                    continue;
                }
                int rgb = img.get(x + j, y + i);
                r = combineOp.applyAsInt(r, PixelOps.red(rgb));
                g = combineOp.applyAsInt(g, PixelOps.green(rgb));
                b = combineOp.applyAsInt(b, PixelOps.blue(rgb));
            }
        }
        return PixelOps.rgb(r, g, b);
    }
}
