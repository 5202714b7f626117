package com.dailystatus.app;

import com.dailystatus.config.ConfigFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DailyStatusSettingsTest {

    @TempDir
    Path tmp;

    @Test
    void defaultsShouldBindIntoTypedGroups() {
        DailyStatusSettings settings = DailyStatusSettings.bind(ConfigFixtures.withOverrides(tmp, Map.of()));

        assertEquals("https://api.github.com", settings.github().getApiBaseUrl());
        assertEquals(List.of("build-ubuntu.yaml", "build-macos.yaml", "build-windows.yaml"), settings.github().getWorkflows());
        assertEquals("handle-result.yaml", settings.github().getClientsWorkflow());
        assertEquals("GITHUB_TOKEN", settings.github().getTokenEnv());
        assertEquals(100, settings.github().getPerPage());
        assertEquals("mih/git-annex", settings.appveyor().getProject());
        assertEquals(20, settings.appveyor().getRecordsNumber());
        assertEquals(24, settings.report().getLookbackHours());
        assertEquals(".rc", settings.report().getResultSuffix());
        assertFalse(settings.email().isEnabled());
        assertTrue(settings.mail().getFailFast());
        assertEquals(tmp.resolve("clients/clients.yaml"), settings.clientsFile());
    }

    @Test
    void overridesShouldBindWithRelaxedNames() {
        DailyStatusSettings settings = DailyStatusSettings.bind(ConfigFixtures.withOverrides(tmp, Map.of(
                "github.workflows", "a.yaml,b.yaml",
                "github.per-page", "30",
                "report.lookback-hours", "48",
                "email.to", "x@example.org,y@example.org")));

        assertEquals(List.of("a.yaml", "b.yaml"), settings.github().getWorkflows());
        assertEquals(30, settings.github().getPerPage());
        assertEquals(48, settings.report().getLookbackHours());
        assertEquals(List.of("x@example.org", "y@example.org"), settings.email().getTo());
    }

    @Test
    void invalidSettingsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> DailyStatusSettings.bind(ConfigFixtures.withOverrides(tmp, Map.of("report.lookback-hours", "0"))));
        assertThrows(IllegalArgumentException.class,
                () -> DailyStatusSettings.bind(ConfigFixtures.withOverrides(tmp, Map.of("github.workflows", " , "))));
        assertThrows(IllegalArgumentException.class,
                () -> DailyStatusSettings.bind(ConfigFixtures.withOverrides(tmp, Map.of("github.per-page", "many"))));
    }
}
