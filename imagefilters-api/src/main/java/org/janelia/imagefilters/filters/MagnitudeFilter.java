package org.janelia.imagefilters.filters;

import org.janelia.imagefilters.image.ClampedPixelAccess;
import org.janelia.imagefilters.image.PixelOps;
import org.janelia.imagefilters.kernel.Kernel;
import org.janelia.imagefilters.kernel.Kernels;

/**
 * Gradient magnitude filter. The responses of two kernels are combined per
 * channel as sqrt(x^2 + y^2); only the magnitude is saturated.
 */
public class MagnitudeFilter extends AbstractPixelFilter {

    public static MagnitudeFilter sobel() {
        return new MagnitudeFilter(Kernels.sobelX(), Kernels.sobelY());
    }

    public static MagnitudeFilter scharr() {
        return new MagnitudeFilter(Kernels.scharrX(), Kernels.scharrY());
    }

    public static MagnitudeFilter prewitt() {
        return new MagnitudeFilter(Kernels.prewittX(), Kernels.prewittY());
    }

    private final Kernel kernelX;
    private final Kernel kernelY;

    public MagnitudeFilter(Kernel kernelX, Kernel kernelY) {
        if (kernelX == null || kernelY == null) {
            throw new IllegalArgumentException("Both X and Y kernels are required");
        }
        this.kernelX = kernelX;
        this.kernelY = kernelY;
    }

    public Kernel getKernelX() {
        return kernelX;
    }

    public Kernel getKernelY() {
        return kernelY;
    }

    @Override
    protected int calcNewPixelColor(ClampedPixelAccess img, int x, int y) {
        double[] xSums = new double[3];
        double[] ySums = new double[3];
        KernelOps.weightedSums(img, kernelX, x, y, xSums);
        KernelOps.weightedSums(img, kernelY, x, y, ySums);
        return PixelOps.rgb(
                Math.hypot(xSums[0], ySums[0]),
                Math.hypot(xSums[1], ySums[1]),
                Math.hypot(xSums[2], ySums[2])
        );
    }
}
