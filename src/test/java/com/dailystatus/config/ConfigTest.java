package com.dailystatus.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class ConfigTest {

    @TempDir
    Path tmp;

    @Test
    void classpathDefaultsShouldBeLoaded() {
        Config config = Config.load(tmp);

        Map<String, String> values = config.asMap();
        assertEquals("datalad/git-annex", values.get("github.workflow-repo"));
        assertEquals("build-ubuntu.yaml,build-macos.yaml,build-windows.yaml", values.get("github.workflows"));
        assertEquals("24", values.get("report.lookback-hours"));
        assertSame(tmp, config.workingDir());
    }

    @Test
    void workingDirFileShouldOverrideDefaults() throws IOException {
        Files.writeString(tmp.resolve("config.properties"), "github.workflow-repo=org/fork\nextra.key=x\n");

        Map<String, String> values = Config.load(tmp).asMap();

        assertEquals("org/fork", values.get("github.workflow-repo"));
        assertEquals("x", values.get("extra.key"));
        assertEquals("mih/git-annex", values.get("appveyor.project"));
    }

    @Test
    void explicitOverrideFileShouldBeUsedInsteadOfWorkingDirFile() throws IOException {
        Files.writeString(tmp.resolve("config.properties"), "report.lookback-hours=1\n");
        Path custom = tmp.resolve("custom.properties");
        Files.writeString(custom, "report.lookback-hours=48\n");

        assertEquals("48", Config.load(tmp, custom).asMap().get("report.lookback-hours"));
    }

    @Test
    void missingOverrideFileShouldKeepDefaults() {
        assertEquals("24", Config.load(tmp, tmp.resolve("absent.properties")).asMap().get("report.lookback-hours"));
    }

    @Test
    void keysShouldBeSorted() {
        List<String> keys = List.copyOf(Config.load(tmp).asMap().keySet());

        assertEquals(keys.stream().sorted().toList(), keys);
    }
}
