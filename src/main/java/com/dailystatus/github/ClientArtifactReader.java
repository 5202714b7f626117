package com.dailystatus.github;

import com.dailystatus.core.ContractViolationException;
import com.dailystatus.model.Outcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Turns a client result archive into per-test outcomes. Each top-level {@code <test>.rc}
 * entry holds the return code of one test.
 */
public final class ClientArtifactReader {
    private static final Logger LOG = LogManager.getLogger(ClientArtifactReader.class);

    private final String resultSuffix;

    public ClientArtifactReader(String resultSuffix) {
        if (resultSuffix == null || resultSuffix.isEmpty()) {
            throw new IllegalArgumentException("result suffix must not be empty");
        }
        this.resultSuffix = resultSuffix;
    }

    /**
     * Downloads the archive to a temporary file, reads it and removes the file again.
     */
    public Map<String, Outcome> readOutcomes(GithubActionsClient client, String archiveDownloadUrl) {
        Path tmp;
        try {
            tmp = Files.createTempFile("client-result-", ".zip");
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create temporary artifact file", e);
        }
        try {
            client.downloadArtifact(archiveDownloadUrl, tmp);
            return parse(tmp);
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                LOG.warn("failed to delete temporary artifact {}: {}", tmp, e.getMessage());
            }
        }
    }

    public Map<String, Outcome> parse(Path archive) {
        Map<String, Outcome> tests = new LinkedHashMap<>();
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                String name = entry.getName();
                if (entry.isDirectory() || name.contains("/") || !name.endsWith(resultSuffix)) {
                    continue;
                }
                String testName = name.substring(0, name.length() - resultSuffix.length());
                tests.put(testName, Outcome.fromReturnCode(readReturnCode(zip, entry)));
            }
        } catch (IOException e) {
            throw new ContractViolationException("unreadable result archive: " + e.getMessage(), e);
        }
        return tests;
    }

    private int readReturnCode(ZipFile zip, ZipEntry entry) throws IOException {
        String raw;
        try (InputStream in = zip.getInputStream(entry)) {
            raw = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ContractViolationException("non-numeric return code in " + entry.getName() + ": '" + raw + "'", e);
        }
    }
}
