package org.janelia.imagefilters.image;

import net.imglib2.Cursor;
import net.imglib2.IterableInterval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.view.Views;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Independent value histograms for the red, green and blue channels.
 */
public class RGBPixelHistogram {

    private final ValuesHistogram rHistogram;
    private final ValuesHistogram gHistogram;
    private final ValuesHistogram bHistogram;

    public RGBPixelHistogram() {
        this.rHistogram = new ValuesHistogram();
        this.gHistogram = new ValuesHistogram();
        this.bHistogram = new ValuesHistogram();
    }

    public static RGBPixelHistogram of(RandomAccessibleInterval<ARGBType> img) {
        RGBPixelHistogram histogram = new RGBPixelHistogram();
        IterableInterval<ARGBType> imgIterable = Views.flatIterable(img);
        Cursor<ARGBType> imgCursor = imgIterable.cursor();
        while (imgCursor.hasNext()) {
            histogram.add(imgCursor.next().get());
        }
        return histogram;
    }

    public void add(int rgb) {
        rHistogram.add(PixelOps.red(rgb));
        gHistogram.add(PixelOps.green(rgb));
        bHistogram.add(PixelOps.blue(rgb));
    }

    public long getCount() {
        return rHistogram.getCount();
    }

    public int minVal() {
        return PixelOps.rgb(rHistogram.minVal(), gHistogram.minVal(), bHistogram.minVal());
    }

    public int maxVal() {
        return PixelOps.rgb(rHistogram.maxVal(), gHistogram.maxVal(), bHistogram.maxVal());
    }

    /**
     * @return per channel means as {red, green, blue}.
     */
    public double[] meanVals() {
        return new double[] {rHistogram.meanVal(), gHistogram.meanVal(), bHistogram.meanVal()};
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("count", getCount())
                .append("min", Integer.toHexString(minVal()))
                .append("max", Integer.toHexString(maxVal()))
                .toString();
    }
}
