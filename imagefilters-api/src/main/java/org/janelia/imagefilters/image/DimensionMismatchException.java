package org.janelia.imagefilters.image;

import java.util.Arrays;

import net.imglib2.Interval;

public class DimensionMismatchException extends IllegalArgumentException {

    public DimensionMismatchException(Interval img1, Interval img2) {
        super("Image shapes differ: " + Arrays.toString(img1.dimensionsAsLongArray()) +
                " vs " + Arrays.toString(img2.dimensionsAsLongArray()));
    }
}
