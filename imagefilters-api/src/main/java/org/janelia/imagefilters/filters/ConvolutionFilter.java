package org.janelia.imagefilters.filters;

import org.janelia.imagefilters.image.ClampedPixelAccess;
import org.janelia.imagefilters.image.PixelOps;
import org.janelia.imagefilters.kernel.Kernel;
import org.janelia.imagefilters.kernel.Kernels;

/**
 * Linear filter: each channel of the output is the kernel weighted sum of the
 * neighborhood channel values, saturated to [0, 255].
 */
public class ConvolutionFilter extends AbstractPixelFilter {

    public static ConvolutionFilter blur(int radius) {
        return new ConvolutionFilter(Kernels.box(radius));
    }

    public static ConvolutionFilter gaussian(int radius, float sigma) {
        return new ConvolutionFilter(Kernels.gaussian(radius, sigma));
    }

    public static ConvolutionFilter sharpen() {
        return new ConvolutionFilter(Kernels.sharpen());
    }

    public static ConvolutionFilter sharpen2() {
        return new ConvolutionFilter(Kernels.sharpen2());
    }

    public static ConvolutionFilter sobelX() {
        return new ConvolutionFilter(Kernels.sobelX());
    }

    public static ConvolutionFilter sobelY() {
        return new ConvolutionFilter(Kernels.sobelY());
    }

    public static ConvolutionFilter motionBlur(int n) {
        return new ConvolutionFilter(Kernels.motionBlur(n));
    }

    private final Kernel kernel;

    public ConvolutionFilter(Kernel kernel) {
        if (kernel == null) {
            throw new IllegalArgumentException("Convolution kernel is required");
        }
        this.kernel = kernel;
    }

    public Kernel getKernel() {
        return kernel;
    }

    @Override
    protected int calcNewPixelColor(ClampedPixelAccess img, int x, int y) {
        double[] rgbSums = new double[3];
        KernelOps.weightedSums(img, kernel, x, y, rgbSums);
        return PixelOps.rgb(rgbSums[0], rgbSums[1], rgbSums[2]);
    }
}
