package org.janelia.imagefilters.image;

/**
 * Histogram of 8-bit channel values.
 */
public class ValuesHistogram {
    private static final int NBINS = PixelOps.MAX_CHANNEL_VALUE + 1;

    private final int[] histogram;
    private long count;
    private long sum;

    ValuesHistogram() {
        histogram = new int[NBINS];
    }

    void add(int val) {
        int ci = PixelOps.clamp(val);
        histogram[ci]++;
        count++;
        sum += ci;
    }

    long getCount() {
        return count;
    }

    int minVal() {
        for (int v = 0; v < NBINS; v++) {
            if (histogram[v] > 0) {
                return v;
            }
        }
        return 0;
    }

    int maxVal() {
        for (int v = NBINS - 1; v >= 0; v--) {
            if (histogram[v] > 0) {
                return v;
            }
        }
        return 0;
    }

    double meanVal() {
        return count > 0 ? (double) sum / count : 0;
    }

}
