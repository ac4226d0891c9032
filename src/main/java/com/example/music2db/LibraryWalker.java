package com.example.music2db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Enumerates audio files under a library root.
 *
 * <p>Each call to {@link #candidates(Path)} walks the tree twice: once to find
 * directories that contain the ignore marker, then lazily to yield regular
 * files with a recognized extension. Symlinks are never followed or reported,
 * and ignored directories are not descended into. Unreadable entries are
 * logged and skipped.
 */
public final class LibraryWalker {
    private static final Logger LOGGER = LoggerFactory.getLogger(LibraryWalker.class);

    private final Set<String> extensions;
    private final String ignoreMarker;

    public LibraryWalker(Set<String> extensions, String ignoreMarker) {
        this.extensions = Set.copyOf(extensions);
        this.ignoreMarker = ignoreMarker;
    }

    public LibraryWalker(ClientConfig config) {
        this(config.extensions(), config.ignoreMarker());
    }

    /**
     * Lazily yields candidate files. The ignore set is recomputed every time
     * iteration starts.
     */
    public Iterable<Path> candidates(Path root) {
        return () -> new CandidateIterator(root, findIgnoredDirectories(root));
    }

    /**
     * First pass: every directory holding an ignore marker.
     */
    public Set<Path> findIgnoredDirectories(Path root) {
        Set<Path> ignored = new HashSet<>();
        Deque<Path> pending = new ArrayDeque<>();
        pending.addLast(root);
        while (!pending.isEmpty()) {
            Path current = pending.removeFirst();
            for (Entry entry : list(current)) {
                if (entry.attrs().isDirectory()) {
                    pending.addLast(entry.path());
                } else if (ignoreMarker.equals(entry.path().getFileName().toString())) {
                    LOGGER.debug("Ignoring directory: {}", current);
                    ignored.add(current);
                }
            }
        }
        return ignored;
    }

    boolean hasRecognizedExtension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return false;
        }
        return extensions.contains(name.substring(dot).toLowerCase(Locale.ROOT));
    }

    /**
     * Lists one directory in name order, without symlinks. Failures are logged
     * and produce whatever entries were read before the failure.
     */
    private List<Entry> list(Path directory) {
        List<Entry> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path path : stream) {
                BasicFileAttributes attrs;
                try {
                    attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                } catch (IOException ex) {
                    LOGGER.warn("Error accessing {}: {}", path, ex.toString());
                    continue;
                }
                if (attrs.isSymbolicLink()) {
                    continue;
                }
                entries.add(new Entry(path, attrs));
            }
        } catch (IOException | DirectoryIteratorException ex) {
            LOGGER.warn("Failed to list directory {}: {}", directory, ex.toString());
        }
        entries.sort(Comparator.comparing(Entry::path));
        return entries;
    }

    private record Entry(Path path, BasicFileAttributes attrs) {
    }

    private final class CandidateIterator implements Iterator<Path> {
        private final Deque<Path> pendingDirectories = new ArrayDeque<>();
        private final Deque<Path> pendingFiles = new ArrayDeque<>();
        private final Set<Path> ignored;
        private Path next;

        private CandidateIterator(Path root, Set<Path> ignored) {
            this.ignored = ignored;
            pendingDirectories.addLast(root);
        }

        @Override
        public boolean hasNext() {
            while (next == null) {
                if (!pendingFiles.isEmpty()) {
                    next = pendingFiles.removeFirst();
                } else if (!pendingDirectories.isEmpty()) {
                    expand(pendingDirectories.removeFirst());
                } else {
                    return false;
                }
            }
            return true;
        }

        @Override
        public Path next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Path result = next;
            next = null;
            return result;
        }

        private void expand(Path directory) {
            if (ignored.contains(directory)) {
                LOGGER.debug("Skipping ignored directory {}", directory);
                return;
            }
            for (Entry entry : list(directory)) {
                if (entry.attrs().isDirectory()) {
                    pendingDirectories.addLast(entry.path());
                } else if (entry.attrs().isRegularFile() && hasRecognizedExtension(entry.path())) {
                    pendingFiles.addLast(entry.path());
                }
            }
        }
    }
}
