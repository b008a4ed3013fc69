package com.demo.eligibility.service.extraction;

import com.demo.eligibility.model.DocumentKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Finds the documents of one application by file-name marker and extension. Files are
 * scanned in name order, so the first matching name wins.
 */
@Slf4j
@Component
public class DocumentLocator {

    public Map<DocumentKind, Path> locate(Path applicationDir) {
        Map<DocumentKind, Path> found = new EnumMap<>(DocumentKind.class);
        if (applicationDir == null || !Files.isDirectory(applicationDir)) {
            return found;
        }
        List<Path> files;
        try (Stream<Path> s = Files.list(applicationDir)) {
            files = s.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", applicationDir, e.getMessage());
            return found;
        }
        for (Path file : files) {
            String name = file.getFileName().toString();
            for (DocumentKind kind : DocumentKind.values()) {
                if (!found.containsKey(kind) && kind.matches(name)) {
                    found.put(kind, file);
                }
            }
        }
        return found;
    }

    /** Names of the application directories directly under {@code root}, sorted. */
    public List<String> applicationIds(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> s = Files.list(root)) {
            return s.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("Cannot list documents root {}: {}", root, e.getMessage());
            return List.of();
        }
    }
}
