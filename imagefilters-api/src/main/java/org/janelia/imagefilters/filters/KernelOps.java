package org.janelia.imagefilters.filters;

import org.janelia.imagefilters.image.ClampedPixelAccess;
import org.janelia.imagefilters.image.PixelOps;
import org.janelia.imagefilters.kernel.Kernel;

class KernelOps {

    /**
     * Accumulate the kernel weighted channel values of the (x, y) neighborhood
     * into rgbSums. Neighbors outside of the image are replaced with the nearest
     * edge pixel. The sums are not clamped.
     */
    static void weightedSums(ClampedPixelAccess img, Kernel kernel, int x, int y, double[] rgbSums) {
        int radius = kernel.getRadius();
        double r = 0, g = 0, b = 0;
        int k = 0;
        for (int i = -radius; i <= radius; i++) {
            for (int j = -radius; j <= radius; j++, k++) {
                float w = kernel.getAt(k);
                if (w == 0) {
                    continue;
                }
                int rgb = img.get(x + j, y + i);
                r += w * PixelOps.red(rgb);
                g += w * PixelOps.green(rgb);
                b += w * PixelOps.blue(rgb);
            }
        }
        rgbSums[0] = r;
        rgbSums[1] = g;
        rgbSums[2] = b;
    }
}
