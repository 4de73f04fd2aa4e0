package org.janelia.imagefilters.kernel;

public class MalformedKernelSourceException extends IllegalArgumentException {

    public MalformedKernelSourceException(String message) {
        super(message);
    }

    public MalformedKernelSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
