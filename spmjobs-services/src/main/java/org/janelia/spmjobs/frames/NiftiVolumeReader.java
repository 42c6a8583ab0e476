package org.janelia.spmjobs.frames;

import org.apache.commons.lang3.StringUtils;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.zip.GZIPInputStream;

/**
 * Reads the dimensions from a NIfTI-1 or Analyze 7.5 header.
 */
public class NiftiVolumeReader implements VolumeReader {
    static final int HEADER_SIZE = 348;
    private static final int DIM_OFFSET = 40;
    private static final int MAX_DIMS = 7;

    @Override
    public VolumeHeader open(String path) {
        if (StringUtils.isBlank(path)) {
            throw new DataAccessException(path, "No volume path has been specified");
        }
        Path headerPath = getHeaderPath(path);
        if (Files.notExists(headerPath)) {
            throw new DataAccessException(path, "Volume header " + headerPath + " not found");
        }
        byte[] headerBytes = new byte[HEADER_SIZE];
        try (DataInputStream headerStream = new DataInputStream(openStream(headerPath))) {
            headerStream.readFully(headerBytes);
        } catch (EOFException e) {
            throw new DataAccessException(path, "Volume header " + headerPath + " is truncated", e);
        } catch (IOException e) {
            throw new DataAccessException(path, "Error reading volume header " + headerPath, e);
        }
        return new VolumeHeader(path, readShape(path, headerBytes));
    }

    private Path getHeaderPath(String path) {
        if (StringUtils.endsWithIgnoreCase(path, ".img")) {
            return Paths.get(StringUtils.removeEndIgnoreCase(path, ".img") + ".hdr");
        } else if (StringUtils.endsWithIgnoreCase(path, ".img.gz")) {
            return Paths.get(StringUtils.removeEndIgnoreCase(path, ".img.gz") + ".hdr.gz");
        } else {
            return Paths.get(path);
        }
    }

    private InputStream openStream(Path headerPath) throws IOException {
        InputStream fileStream = new BufferedInputStream(Files.newInputStream(headerPath));
        if (StringUtils.endsWithIgnoreCase(headerPath.toString(), ".gz")) {
            return new GZIPInputStream(fileStream);
        } else {
            return fileStream;
        }
    }

    private int[] readShape(String path, byte[] headerBytes) {
        ByteBuffer headerBuffer = ByteBuffer.wrap(headerBytes).order(ByteOrder.LITTLE_ENDIAN);
        if (headerBuffer.getInt(0) != HEADER_SIZE) {
            headerBuffer.order(ByteOrder.BIG_ENDIAN);
            if (headerBuffer.getInt(0) != HEADER_SIZE) {
                throw new DataAccessException(path, "Invalid header size in " + path);
            }
        }
        int ndims = headerBuffer.getShort(DIM_OFFSET);
        if (ndims < 1 || ndims > MAX_DIMS) {
            throw new DataAccessException(path, "Invalid number of dimensions " + ndims + " in " + path);
        }
        int[] dims = new int[ndims];
        for (int i = 0; i < ndims; i++) {
            dims[i] = headerBuffer.getShort(DIM_OFFSET + 2 * (i + 1));
            if (dims[i] < 1) {
                throw new DataAccessException(path, "Invalid dimension " + (i + 1) + " = " + dims[i] + " in " + path);
            }
        }
        // singleton dimensions past the time axis do not count
        int rank = ndims;
        while (rank > 4 && dims[rank - 1] == 1) {
            rank--;
        }
        return Arrays.copyOf(dims, rank);
    }
}
