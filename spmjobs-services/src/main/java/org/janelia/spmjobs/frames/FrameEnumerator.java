package org.janelia.spmjobs.frames;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Lists the frames of 3D and 4D volumes using SPM's "file,index" notation.
 * A 3D volume is a single frame with index 1.
 */
@ApplicationScoped
public class FrameEnumerator {

    private final VolumeReader volumeReader;
    private final Logger logger;

    @Inject
    public FrameEnumerator(VolumeReader volumeReader, Logger logger) {
        this.volumeReader = volumeReader;
        this.logger = logger;
    }

    public List<FrameReference> enumerate(String path) {
        VolumeHeader volumeHeader = volumeReader.open(path);
        int[] shape = volumeHeader.shape();
        int nFrames;
        if (shape.length == 3) {
            nFrames = 1;
        } else if (shape.length == 4) {
            nFrames = shape[3];
        } else {
            logger.error("Unsupported volume shape {} for {}", Arrays.toString(shape), path);
            throw new DataAccessException(path, "Unsupported number of dimensions " + shape.length + " for " + path + " - only 3D and 4D volumes are supported");
        }
        if (Arrays.stream(shape).anyMatch(d -> d < 1)) {
            logger.error("Empty volume shape {} for {}", Arrays.toString(shape), path);
            throw new DataAccessException(path, "Invalid volume shape " + Arrays.toString(shape) + " for " + path + " - every dimension must be at least 1");
        }
        logger.debug("Found {} frames in {}", nFrames, path);
        return IntStream.rangeClosed(1, nFrames)
                .mapToObj(frameIndex -> new FrameReference(path, frameIndex))
                .collect(Collectors.toList());
    }

    public List<List<FrameReference>> enumerateMultiple(List<String> paths) {
        return paths.stream()
                .map(this::enumerate)
                .collect(Collectors.toList());
    }
}
