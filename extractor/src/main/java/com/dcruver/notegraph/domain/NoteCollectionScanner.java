package com.dcruver.notegraph.domain;

import com.dcruver.notegraph.config.ExtractorProperties;
import com.dcruver.notegraph.identity.NameNormalizer;
import com.dcruver.notegraph.io.NoteFileReader;
import com.dcruver.notegraph.io.NoteSource;
import com.dcruver.notegraph.parse.FragmentExtractor;
import com.dcruver.notegraph.parse.NoteFragment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

/**
 * Walks the note collection and runs per-note extraction on a worker pool.
 *
 * Each note is read and parsed independently; a failure in one note is recorded as a
 * skipped entry and never affects the others. Results come back in relative-path order
 * regardless of which worker finished first.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NoteCollectionScanner {

    static final String EMPTY_PAGE_NAME = "maps to an empty page name";

    private final ExtractorProperties properties;
    private final NoteFileReader fileReader;
    private final FragmentExtractor fragmentExtractor;
    private final NameNormalizer normalizer;

    public ScanResult scan(Path notesRoot) {
        Path root = notesRoot.toAbsolutePath().normalize();

        if (!Files.exists(root)) {
            log.warn("Notes directory does not exist: {}", root);
            return new ScanResult(0, List.of(), List.of(new SkippedNote(root.toString(), "notes directory does not exist")));
        }

        if (!Files.isDirectory(root)) {
            log.error("Notes path is not a directory: {}", root);
            return new ScanResult(0, List.of(), List.of(new SkippedNote(root.toString(), "notes path is not a directory")));
        }

        List<Path> noteFiles;
        try {
            noteFiles = listNotes(root);
        } catch (IOException e) {
            log.error("Failed to walk notes directory: {}", root, e);
            return new ScanResult(0, List.of(), List.of(new SkippedNote(root.toString(), "cannot list notes: " + e.getMessage())));
        }

        log.info("Scanning {} notes under {} with {} workers", noteFiles.size(), root, properties.effectiveParallelism());

        List<NoteFragment> fragments = new ArrayList<>();
        List<SkippedNote> skipped = new ArrayList<>();

        ExecutorService executor = Executors.newFixedThreadPool(properties.effectiveParallelism());
        try {
            List<Future<NoteOutcome>> futures = new ArrayList<>();
            for (Path file : noteFiles) {
                futures.add(executor.submit(extractTask(root, file)));
            }

            for (int i = 0; i < futures.size(); i++) {
                NoteOutcome outcome = await(futures.get(i), fileReader.relativePath(root, noteFiles.get(i)));
                if (outcome.fragment != null) {
                    fragments.add(outcome.fragment);
                } else {
                    skipped.add(outcome.skipped);
                }
            }
        } finally {
            executor.shutdown();
        }

        log.info("Extracted {} notes, skipped {}", fragments.size(), skipped.size());
        return new ScanResult(noteFiles.size(), List.copyOf(fragments), List.copyOf(skipped));
    }

    private List<Path> listNotes(Path root) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(fileReader::isNote)
                .sorted(Comparator.comparing(p -> fileReader.relativePath(root, p)))
                .toList();
        }
    }

    private Callable<NoteOutcome> extractTask(Path root, Path file) {
        return () -> {
            String relativePath = fileReader.relativePath(root, file);
            try {
                NoteSource source = fileReader.read(root, file);
                if (normalizer.normalizePageName(source.getPageName()).isEmpty()) {
                    log.warn("Skipping note {}: its path maps to an empty page name", relativePath);
                    return NoteOutcome.skipped(new SkippedNote(relativePath, EMPTY_PAGE_NAME));
                }
                NoteFragment fragment = fragmentExtractor.extract(source.getRelativePath(), source.getPageName(), source.getText());
                return NoteOutcome.extracted(fragment);
            } catch (IOException e) {
                log.error("Failed to read note: {}", relativePath, e);
                return NoteOutcome.skipped(new SkippedNote(relativePath, "read failed: " + e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Failed to extract note: {}", relativePath, e);
                return NoteOutcome.skipped(new SkippedNote(relativePath, "extraction failed: " + e));
            }
        };
    }

    private NoteOutcome await(Future<NoteOutcome> future, String relativePath) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return NoteOutcome.skipped(new SkippedNote(relativePath, "interrupted"));
        } catch (ExecutionException e) {
            log.error("Worker failed on note: {}", relativePath, e.getCause());
            return NoteOutcome.skipped(new SkippedNote(relativePath, "worker failed: " + e.getCause()));
        }
    }

    private static final class NoteOutcome {
        final NoteFragment fragment;
        final SkippedNote skipped;

        private NoteOutcome(NoteFragment fragment, SkippedNote skipped) {
            this.fragment = fragment;
            this.skipped = skipped;
        }

        static NoteOutcome extracted(NoteFragment fragment) {
            return new NoteOutcome(fragment, null);
        }

        static NoteOutcome skipped(SkippedNote skipped) {
            return new NoteOutcome(null, skipped);
        }
    }
}
