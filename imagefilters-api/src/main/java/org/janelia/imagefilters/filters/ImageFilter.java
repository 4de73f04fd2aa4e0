package org.janelia.imagefilters.filters;

import java.util.concurrent.ExecutorService;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;

/**
 * An image to image operation. The input image is never modified and the
 * result is always a new zero-origin image.
 */
public interface ImageFilter {

    Img<ARGBType> process(RandomAccessibleInterval<ARGBType> img);

    /**
     * Process the image using the given executor. Filters that cannot split
     * their work process the image on the calling thread.
     */
    default Img<ARGBType> process(RandomAccessibleInterval<ARGBType> img, ExecutorService executorService) {
        return process(img);
    }

    default ImageFilter andThen(ImageFilter after) {
        ImageFilter thisFilter = this;
        return new ImageFilter() {
            @Override
            public Img<ARGBType> process(RandomAccessibleInterval<ARGBType> img) {
                return after.process(thisFilter.process(img));
            }

            @Override
            public Img<ARGBType> process(RandomAccessibleInterval<ARGBType> img, ExecutorService executorService) {
                return after.process(thisFilter.process(img, executorService), executorService);
            }
        };
    }
}
