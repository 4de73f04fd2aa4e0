package org.janelia.imagefilters.image;

/**
 * Maps a target pixel position back to the source position it is read from.
 */
public interface GeomTransform {
    /**
     * @param currentPos position in the output image
     * @param originPos receives the position in the input image
     */
    void apply(long[] currentPos, long[] originPos);

    /**
     * @return a transform that first applies this mapping and then maps the result with the given transform.
     */
    default GeomTransform andThen(GeomTransform next) {
        return (currentPos, originPos) -> {
            long[] intermediatePos = new long[currentPos.length];
            apply(currentPos, intermediatePos);
            next.apply(intermediatePos, originPos);
        };
    }
}
