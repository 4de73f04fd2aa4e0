package org.janelia.imagefilters.filters;

import org.janelia.imagefilters.image.GlassTransform;

public class GlassFilter extends GeomTransformFilter {

    public static final long DEFAULT_SEED = 0;

    public GlassFilter() {
        this(DEFAULT_SEED);
    }

    public GlassFilter(long seed) {
        super(new GlassTransform(seed));
    }
}
