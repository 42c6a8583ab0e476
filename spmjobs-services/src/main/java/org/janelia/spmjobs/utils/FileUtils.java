package org.janelia.spmjobs.utils;

import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.stream.Collectors;

/**
 * File name helpers used to predict the names of the files written by SPM.
 */
public class FileUtils {

    public static String getFileName(String fn) {
        return StringUtils.isBlank(fn) ? "" : Paths.get(fn).getFileName().toString();
    }

    public static String getFileNameOnly(String fn) {
        return StringUtils.isBlank(fn) ? "" : com.google.common.io.Files.getNameWithoutExtension(fn);
    }

    public static String getFileExtensionOnly(Path fp) {
        return getFileExtensionOnly(fp.toString());
    }

    public static String getFileExtensionOnly(String fn) {
        return StringUtils.isBlank(fn) ? "" : createExtension(com.google.common.io.Files.getFileExtension(fn));
    }

    private static String createExtension(String ext) {
        if (StringUtils.isBlank(ext)) {
            return "";
        } else {
            return StringUtils.prependIfMissing(ext, ".");
        }
    }

    public static Path getFilePath(Path dir, String prefix, String fileName, String suffix, String fileExt) {
        String actualFileName = String.format("%s%s%s%s",
                StringUtils.defaultIfBlank(prefix, ""),
                FileUtils.getFileNameOnly(fileName),
                StringUtils.defaultIfBlank(suffix, ""),
                createExtension(fileExt));
        return dir != null ? dir.resolve(actualFileName) : Paths.get(actualFileName);
    }

    /**
     * Inserts a prefix and a suffix around the base name of the file, keeping its directory.
     * Only the last extension is treated as the extension so "a.nii.gz" becomes "{prefix}a.nii{suffix}.gz".
     *
     * @param fileName file to rename
     * @param prefix inserted before the base name
     * @param suffix inserted after the base name, before the extension
     * @param useExt if false the extension is dropped
     * @return the new file name
     */
    public static String presuffix(String fileName, String prefix, String suffix, boolean useExt) {
        Path filePath = Paths.get(fileName);
        String ext = useExt ? getFileExtensionOnly(filePath) : "";
        return getFilePath(filePath.getParent(), prefix, getFileName(fileName), suffix, ext).toString();
    }

    public static String presuffix(String fileName, String prefix, String suffix) {
        return presuffix(fileName, prefix, suffix, true);
    }

    public static List<String> presuffix(List<String> fileNames, String prefix, String suffix) {
        return fileNames.stream()
                .map(fn -> presuffix(fn, prefix, suffix))
                .collect(Collectors.toList());
    }

    public static List<String> prefixFileNames(List<String> fileNames, String prefix) {
        return presuffix(fileNames, prefix, "");
    }

    /**
     * Delete a file or a directory tree. A missing path is ignored.
     */
    public static void deletePath(Path path) throws IOException {
        if (path == null || Files.notExists(path)) {
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
