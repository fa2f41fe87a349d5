package com.lexhub.gameservice.games.letterfall.infrastructure.file;

import com.lexhub.gameservice.games.letterfall.domain.repository.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Optional;

/**
 * 会话存档的本地文件实现（letterfall.session.store=file）。
 * 写入先落到同目录临时文件，再原子替换目标文件，读到的要么是旧存档要么是新存档。
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "letterfall.session.store", havingValue = "file")
public class FileSessionStore implements SessionStore {

    private final Path dir;

    public FileSessionStore(@Value("${letterfall.session.dir:./data/sessions}") String dir) {
        this(Paths.get(dir));
    }

    public FileSessionStore(Path dir) {
        this.dir = dir;
    }

    @Override
    public Optional<byte[]> read(String identity) {
        Path file = fileOf(identity);
        if (!Files.exists(file)) return Optional.empty();
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            log.warn("读取存档失败 file={}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void write(String identity, byte[] bytes) {
        Path target = fileOf(identity);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(dir);
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write session " + target, e);
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.debug("清理临时文件失败 {}: {}", tmp, e.getMessage());
            }
        }
    }

    @Override
    public void clear(String identity) {
        try {
            Files.deleteIfExists(fileOf(identity));
        } catch (IOException e) {
            log.warn("删除存档失败 identity={}: {}", identity, e.getMessage());
        }
    }

    /** 身份转成安全文件名：小写，非 [a-z0-9_-] 的字符替换为 '_' */
    Path fileOf(String identity) {
        String safe = identity.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
        return dir.resolve("session-" + safe + ".json");
    }
}
