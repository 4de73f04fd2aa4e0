package org.janelia.imagefilters.image;

/**
 * Rotation by an angle (in radians) around a center in the XY plane.
 */
public class RotateTransform implements GeomTransform {
    private final double centerX;
    private final double centerY;
    private final double cos;
    private final double sin;

    public RotateTransform(double centerX, double centerY, double angle) {
        this.centerX = centerX;
        this.centerY = centerY;
        this.cos = Math.cos(angle);
        this.sin = Math.sin(angle);
    }

    @Override
    public void apply(long[] currentPos, long[] originPos) {
        double dx = currentPos[0] - centerX;
        double dy = currentPos[1] - centerY;
        // inverse rotation: the target pixel reads the source rotated by -angle
        originPos[0] = Math.round(dx * cos + dy * sin + centerX);
        originPos[1] = Math.round(-dx * sin + dy * cos + centerY);
    }
}
