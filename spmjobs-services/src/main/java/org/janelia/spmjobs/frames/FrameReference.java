package org.janelia.spmjobs.frames;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * Reference to one frame of a volume in SPM notation: "path,index" with a 1-based index.
 */
public final class FrameReference {
    private final String path;
    private final int index;

    public FrameReference(String path, int index) {
        Preconditions.checkArgument(path != null, "Frame path cannot be null");
        Preconditions.checkArgument(index > 0, "Frame index must be positive: %s", index);
        this.path = path;
        this.index = index;
    }

    public String getPath() {
        return path;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        FrameReference that = (FrameReference) o;

        return new EqualsBuilder()
                .append(index, that.index)
                .append(path, that.path)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(path)
                .append(index)
                .toHashCode();
    }

    @Override
    public String toString() {
        return path + "," + index;
    }
}
