package org.janelia.imagefilters.filters;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.imagefilters.image.ClampedPixelAccess;
import org.janelia.imagefilters.image.ImageAccessUtils;
import org.janelia.imagefilters.image.PixelOps;

/**
 * Multiplies every channel by its own coefficient.
 */
public class ColorCorrectionFilter extends AbstractPixelFilter {

    /**
     * Create the correction that maps the source color onto the destination color.
     */
    public static ColorCorrectionFilter fromReferenceColors(int sourceRGB, int destRGB) {
        return new ColorCorrectionFilter(
                channelCoefficient(PixelOps.red(sourceRGB), PixelOps.red(destRGB)),
                channelCoefficient(PixelOps.green(sourceRGB), PixelOps.green(destRGB)),
                channelCoefficient(PixelOps.blue(sourceRGB), PixelOps.blue(destRGB))
        );
    }

    private static float channelCoefficient(int source, int dest) {
        return source == 0 ? 1.f : (float) dest / source;
    }

    private final float coeffR;
    private final float coeffG;
    private final float coeffB;

    public ColorCorrectionFilter() {
        this(1.f, 1.f, 1.f);
    }

    public ColorCorrectionFilter(float coeffR, float coeffG, float coeffB) {
        this.coeffR = coeffR;
        this.coeffG = coeffG;
        this.coeffB = coeffB;
    }

    /**
     * Correct the image so that the pixel at (sourceX, sourceY) becomes the destination color.
     * This filter's own coefficients are not used.
     */
    public Img<ARGBType> process(RandomAccessibleInterval<ARGBType> img, int sourceX, int sourceY, int destRGB) {
        int width = ImageAccessUtils.getWidth(img);
        int height = ImageAccessUtils.getHeight(img);
        if (sourceX < 0 || sourceX >= width || sourceY < 0 || sourceY >= height) {
            throw new IllegalArgumentException("Reference pixel " + sourceX + "," + sourceY +
                    " is outside of the " + width + "x" + height + " image");
        }
        int sourceRGB = ImageAccessUtils.getRGB(img, sourceX, sourceY);
        return fromReferenceColors(sourceRGB, destRGB).process(img);
    }

    public float[] getCoefficients() {
        return new float[] {coeffR, coeffG, coeffB};
    }

    @Override
    protected int calcNewPixelColor(ClampedPixelAccess img, int x, int y) {
        int rgb = img.get(x, y);
        return PixelOps.rgb(
                PixelOps.red(rgb) * (double) coeffR,
                PixelOps.green(rgb) * (double) coeffG,
                PixelOps.blue(rgb) * (double) coeffB
        );
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("coeffR", coeffR)
                .append("coeffG", coeffG)
                .append("coeffB", coeffB)
                .toString();
    }
}
