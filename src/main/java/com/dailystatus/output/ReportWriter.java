package com.dailystatus.output;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes the HTML body to the target file. The file is replaced in one move so a reader
 * never sees a half-written report.
 */
public final class ReportWriter {

    public Path writeHtml(Path target, RenderedReport report) throws IOException {
        Path absolute = target.toAbsolutePath().normalize();
        Path dir = absolute.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = Files.createTempFile(dir, ".daily-status-", ".tmp");
        try {
            Files.writeString(tmp, report.html() + "\n", StandardCharsets.UTF_8);
            Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        return absolute;
    }
}
