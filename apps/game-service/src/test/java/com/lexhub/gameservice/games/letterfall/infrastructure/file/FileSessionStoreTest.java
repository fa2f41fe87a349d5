package com.lexhub.gameservice.games.letterfall.infrastructure.file;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileSessionStoreTest {

    @TempDir
    Path dir;

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void writeThenReadReturnsTheLatestBytes() {
        FileSessionStore store = new FileSessionStore(dir.resolve("sessions"));

        store.write("alice", utf8("{\"v\":1}"));
        store.write("alice", utf8("{\"v\":2}"));

        assertThat(store.read("alice")).hasValueSatisfying(b ->
                assertThat(new String(b, StandardCharsets.UTF_8)).isEqualTo("{\"v\":2}"));
    }

    @Test
    void leavesNoTemporaryFilesBehind() throws Exception {
        FileSessionStore store = new FileSessionStore(dir);

        store.write("alice", utf8("{}"));

        try (var files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("session-alice.json");
        }
    }

    @Test
    void identityIsCaseInsensitiveAndSanitized() {
        FileSessionStore store = new FileSessionStore(dir);

        assertThat(store.fileOf(" Alice ")).isEqualTo(store.fileOf("alice"));
        assertThat(store.fileOf("../evil").getFileName().toString()).isEqualTo("session-___evil.json");
        assertThat(store.fileOf("../evil").getParent()).isEqualTo(dir);
    }

    @Test
    void clearRemovesTheSave() {
        FileSessionStore store = new FileSessionStore(dir);
        store.write("alice", utf8("{}"));

        store.clear("ALICE");

        assertThat(store.read("alice")).isEmpty();
        store.clear("alice");
    }
}
