package org.janelia.imagefilters.morphology;

public enum MorphologicalOperation {
    /** dilate(erode(img)) */
    OPENING,
    /** erode(dilate(img)) */
    CLOSING,
    /** dilate(img) - erode(img) */
    GRADIENT,
    /** img - opening(img) */
    TOP_HAT,
    /** closing(img) - img */
    BLACK_HAT
}
