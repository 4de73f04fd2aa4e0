package org.janelia.imagefilters.filters;

import java.util.concurrent.ExecutorService;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.janelia.imagefilters.image.ImageDifference;
import org.janelia.imagefilters.kernel.Kernel;
import org.janelia.imagefilters.morphology.MorphologicalFilter;
import org.janelia.imagefilters.morphology.MorphologicalOperation;
import org.janelia.imagefilters.morphology.StructuringElementFilter;

/**
 * Static entry points for the kernel based transformations.
 */
public class ImageTransforms {

    public static Img<ARGBType> convolve(RandomAccessibleInterval<ARGBType> img, Kernel kernel) {
        return new ConvolutionFilter(kernel).process(img);
    }

    public static Img<ARGBType> gradientMagnitude(RandomAccessibleInterval<ARGBType> img, Kernel kernelX, Kernel kernelY) {
        return new MagnitudeFilter(kernelX, kernelY).process(img);
    }

    public static Img<ARGBType> dilateImage(RandomAccessibleInterval<ARGBType> img, Kernel structuringElement) {
        return StructuringElementFilter.dilation(structuringElement).process(img);
    }

    public static Img<ARGBType> erodeImage(RandomAccessibleInterval<ARGBType> img, Kernel structuringElement) {
        return StructuringElementFilter.erosion(structuringElement).process(img);
    }

    public static Img<ARGBType> morphologicalTransform(RandomAccessibleInterval<ARGBType> img,
                                                       MorphologicalOperation operation,
                                                       Kernel structuringElement) {
        return new MorphologicalFilter(operation, structuringElement).process(img);
    }

    public static Img<ARGBType> subtractImages(RandomAccessibleInterval<ARGBType> img1,
                                               RandomAccessibleInterval<ARGBType> img2) {
        return ImageDifference.difference(img1, img2);
    }

    public static Img<ARGBType> parallelFilterImage(RandomAccessibleInterval<ARGBType> img,
                                                    ImageFilter filter,
                                                    ExecutorService executorService) {
        return filter.process(img, executorService);
    }
}
