package com.example.music2db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

public final class ChangeDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeDetector.class);

    /**
     * Returns the maximum of the root directory's own modification time and
     * the modification times of every regular, non-symlink file beneath it,
     * in Unix seconds. Entries that cannot be stat-ed are logged and left out.
     */
    public double latestModificationTime(Path root) {
        double[] latest = new double[1];
        try {
            latest[0] = unixSeconds(Files.getLastModifiedTime(root, LinkOption.NOFOLLOW_LINKS));
        } catch (IOException ex) {
            LOGGER.error("Cannot read modification time of {}", root, ex);
            return 0;
        }

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    // walkFileTree does not follow links, so symlinks arrive here with their own attributes
                    if (attrs.isRegularFile() && !attrs.isSymbolicLink()) {
                        latest[0] = Math.max(latest[0], unixSeconds(attrs.lastModifiedTime()));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    LOGGER.warn("Error checking modification time of {}: {}", file, exc.toString());
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                    if (exc != null) {
                        LOGGER.warn("Error listing {} while checking modifications: {}", dir, exc.toString());
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            LOGGER.error("Error checking modifications under {}", root, ex);
        }
        return latest[0];
    }

    static double unixSeconds(FileTime time) {
        return unixSeconds(time.toInstant());
    }

    static double unixSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000d;
    }
}
