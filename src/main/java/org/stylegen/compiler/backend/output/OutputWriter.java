package org.stylegen.compiler.backend.output;

import org.stylegen.compiler.backend.codegen.GeneratedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Writes generated files into the output directory.
 *
 * <p>Every file of a batch is first written to a temporary sibling. Only when all of them are
 * on disk are they moved into place, so a write failure leaves the previous output untouched
 * and readers never see a half-written file. A failing move in the second phase can still
 * leave the batch partly replaced.</p>
 */
public class OutputWriter {

    private static final Logger log = LoggerFactory.getLogger(OutputWriter.class);

    /**
     * @param files     The generated headers.
     * @param directory The output directory, created if missing.
     * @return The written files.
     * @throws IOException if a file cannot be written or moved.
     */
    public List<Path> writeAll(List<GeneratedFile> files, Path directory) throws IOException {
        Map<String, String> contents = new LinkedHashMap<>();
        files.forEach(file -> contents.put(file.fileName(), file.content()));
        return writeAll(contents, directory);
    }

    /**
     * @param contents  File content by file name relative to {@code directory}, in write order.
     * @param directory The output directory, created if missing.
     * @return The written files, in the order of {@code contents}.
     * @throws IOException if a file cannot be written or moved; staged temporaries are removed.
     */
    public List<Path> writeAll(Map<String, String> contents, Path directory) throws IOException {
        Files.createDirectories(directory);
        Map<Path, Path> staged = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, String> entry : contents.entrySet()) {
                Path target = directory.resolve(entry.getKey());
                staged.put(target, stage(target, entry.getValue()));
            }
            for (Map.Entry<Path, Path> entry : staged.entrySet()) {
                Files.move(entry.getValue(), entry.getKey(),
                        StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            cleanUp(staged.values());
            throw e;
        }
        log.info("Wrote {} file(s) to {}", staged.size(), directory);
        return new ArrayList<>(staged.keySet());
    }

    private Path stage(Path target, String content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tempFile = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.writeString(tempFile, content, StandardCharsets.UTF_8);
        return tempFile;
    }

    private void cleanUp(Iterable<Path> tempFiles) {
        for (Path tempFile : tempFiles) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after write failure: {}", tempFile, cleanupEx);
            }
        }
    }
}
