package com.energyweather.recon.ingest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists raw input files (recursively) in the configured processing order.
 */
public final class RawFileScanner {
    private static final Logger LOG = LogManager.getLogger(RawFileScanner.class);

    private final IngestOrder order;
    private final Set<String> extensions;

    public RawFileScanner(IngestOrder order, List<String> extensions) {
        this.order = order == null ? IngestOrder.LEXICAL : order;
        Set<String> exts = new LinkedHashSet<>();
        List<String> source = extensions == null || extensions.isEmpty() ? List.of("csv", "json") : extensions;
        for (String ext : source) {
            String e = ext == null ? "" : ext.trim().toLowerCase(Locale.ROOT);
            if (e.startsWith(".")) {
                e = e.substring(1);
            }
            if (!e.isEmpty()) {
                exts.add(e);
            }
        }
        this.extensions = Set.copyOf(exts);
    }

    /** Returns an empty list when {@code rawDir} does not exist. */
    public List<Path> scan(Path rawDir) throws IOException {
        if (rawDir == null || !Files.isDirectory(rawDir)) {
            LOG.warn("Raw data directory not found: {}", rawDir);
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(rawDir)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(this::hasSupportedExtension)
                    .collect(Collectors.toCollection(ArrayList::new));
        }
        Comparator<Path> comparator = order.comparator(rawDir);
        try {
            files.sort(comparator);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        LOG.info("Found {} raw file(s) under {} order={}", files.size(), rawDir, order.name().toLowerCase(Locale.ROOT));
        return List.copyOf(files);
    }

    private boolean hasSupportedExtension(Path file) {
        Path name = file.getFileName();
        return name != null && extensions.contains(FileNameParser.extension(name.toString()));
    }
}
