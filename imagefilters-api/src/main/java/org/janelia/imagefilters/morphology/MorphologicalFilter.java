package org.janelia.imagefilters.morphology;

import java.util.concurrent.ExecutorService;

import javax.annotation.Nullable;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.janelia.imagefilters.filters.ImageFilter;
import org.janelia.imagefilters.image.ImageDifference;
import org.janelia.imagefilters.kernel.Kernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Morphological operators derived from erosion and dilation with a single
 * structuring element. All the pixel work is done by the primitive filters
 * and by the image difference.
 */
public class MorphologicalFilter implements ImageFilter {

    private static final Logger LOG = LoggerFactory.getLogger(MorphologicalFilter.class);

    public static MorphologicalFilter opening(Kernel structuringElement) {
        return new MorphologicalFilter(MorphologicalOperation.OPENING, structuringElement);
    }

    public static MorphologicalFilter closing(Kernel structuringElement) {
        return new MorphologicalFilter(MorphologicalOperation.CLOSING, structuringElement);
    }

    public static MorphologicalFilter gradient(Kernel structuringElement) {
        return new MorphologicalFilter(MorphologicalOperation.GRADIENT, structuringElement);
    }

    public static MorphologicalFilter topHat(Kernel structuringElement) {
        return new MorphologicalFilter(MorphologicalOperation.TOP_HAT, structuringElement);
    }

    public static MorphologicalFilter blackHat(Kernel structuringElement) {
        return new MorphologicalFilter(MorphologicalOperation.BLACK_HAT, structuringElement);
    }

    private final MorphologicalOperation operation;
    private final Kernel structuringElement;

    public MorphologicalFilter(MorphologicalOperation operation, Kernel structuringElement) {
        if (operation == null || structuringElement == null) {
            throw new IllegalArgumentException("Both the operation and the structuring element are required");
        }
        this.operation = operation;
        this.structuringElement = structuringElement;
    }

    public MorphologicalOperation getOperation() {
        return operation;
    }

    public Kernel getStructuringElement() {
        return structuringElement;
    }

    @Override
    public Img<ARGBType> process(RandomAccessibleInterval<ARGBType> img) {
        return process(img, null);
    }

    @Override
    public Img<ARGBType> process(RandomAccessibleInterval<ARGBType> img, @Nullable ExecutorService executorService) {
        LOG.debug("Apply {} with a structuring element of radius {}", operation, structuringElement.getRadius());
        switch (operation) {
            case OPENING:
                return open(img, executorService);
            case CLOSING:
                return close(img, executorService);
            case GRADIENT:
                return ImageDifference.difference(dilate(img, executorService), erode(img, executorService));
            case TOP_HAT:
                return ImageDifference.difference(img, open(img, executorService));
            case BLACK_HAT:
                return ImageDifference.difference(close(img, executorService), img);
            default:
                throw new IllegalStateException("Unsupported morphological operation: " + operation);
        }
    }

    private Img<ARGBType> open(RandomAccessibleInterval<ARGBType> img, ExecutorService executorService) {
        return dilate(erode(img, executorService), executorService);
    }

    private Img<ARGBType> close(RandomAccessibleInterval<ARGBType> img, ExecutorService executorService) {
        return erode(dilate(img, executorService), executorService);
    }

    private Img<ARGBType> dilate(RandomAccessibleInterval<ARGBType> img, ExecutorService executorService) {
        return StructuringElementFilter.dilation(structuringElement).process(img, executorService);
    }

    private Img<ARGBType> erode(RandomAccessibleInterval<ARGBType> img, ExecutorService executorService) {
        return StructuringElementFilter.erosion(structuringElement).process(img, executorService);
    }
}
