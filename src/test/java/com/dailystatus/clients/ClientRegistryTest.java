package com.dailystatus.clients;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClientRegistryTest {

    @TempDir
    Path tmp;

    @Test
    void topLevelKeysShouldBeClientIds() throws IOException {
        Path file = tmp.resolve("clients.yaml");
        Files.writeString(file, ""
                + "typhon:\n"
                + "  admin: someone\n"
                + "  os: debian\n"
                + "smaug:\n"
                + "  admin: other\n");

        assertEquals(List.of("smaug", "typhon"), List.copyOf(ClientRegistry.loadClientIds(file)));
    }

    @Test
    void emptyFileShouldMeanNoClients() throws IOException {
        Path file = tmp.resolve("clients.yaml");
        Files.writeString(file, "");

        assertTrue(ClientRegistry.loadClientIds(file).isEmpty());
    }

    @Test
    void missingOrMalformedFileShouldFail() throws IOException {
        Path list = tmp.resolve("list.yaml");
        Files.writeString(list, "- a\n- b\n");
        Path broken = tmp.resolve("broken.yaml");
        Files.writeString(broken, "a: [unclosed\n");

        assertThrows(IOException.class, () -> ClientRegistry.loadClientIds(tmp.resolve("absent.yaml")));
        assertThrows(IOException.class, () -> ClientRegistry.loadClientIds(list));
        assertThrows(IOException.class, () -> ClientRegistry.loadClientIds(broken));
    }
}
