package org.janelia.spmjobs.frames;

import java.util.Arrays;

/**
 * Volume metadata returned by a {@link VolumeReader}.
 */
public class VolumeHeader {
    private final String path;
    private final int[] shape;

    public VolumeHeader(String path, int... shape) {
        this.path = path;
        this.shape = Arrays.copyOf(shape, shape.length);
    }

    public String getPath() {
        return path;
    }

    public int[] shape() {
        return Arrays.copyOf(shape, shape.length);
    }

    public int rank() {
        return shape.length;
    }

    @Override
    public String toString() {
        return path + Arrays.toString(shape);
    }
}
