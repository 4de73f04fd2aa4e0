package org.janelia.imagefilters.image;

/**
 * Translation in the XY plane: the pixel at p is read from p - (deltaX, deltaY),
 * so positive deltas move the content right and down.
 */
public class ShiftTransform implements GeomTransform {
    private final long deltaX;
    private final long deltaY;

    public ShiftTransform(long deltaX, long deltaY) {
        this.deltaX = deltaX;
        this.deltaY = deltaY;
    }

    @Override
    public void apply(long[] currentPos, long[] originPos) {
        originPos[0] = currentPos[0] - deltaX;
        originPos[1] = currentPos[1] - deltaY;
    }
}
