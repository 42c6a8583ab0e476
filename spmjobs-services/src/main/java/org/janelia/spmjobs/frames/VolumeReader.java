package org.janelia.spmjobs.frames;

public interface VolumeReader {
    /**
     * Read the volume metadata.
     *
     * @param path volume location
     * @return volume header
     * @throws DataAccessException if the volume cannot be opened
     */
    VolumeHeader open(String path);
}
