package com.lexhub.gameservice.games.letterfall.domain.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexhub.gameservice.games.letterfall.domain.dto.SessionSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Optional;

/**
 * 快照 ⇄ 字节（UTF-8 JSON）。
 * 解析失败一律视为存档损坏，返回 empty 由上层丢弃存档。
 */
@Slf4j
public class SessionCodec {

    private final ObjectMapper mapper;

    public SessionCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public byte[] encode(SessionSnapshot snapshot) {
        try {
            return mapper.writeValueAsBytes(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to encode session snapshot", e);
        }
    }

    public Optional<SessionSnapshot> decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) return Optional.empty();
        try {
            return Optional.ofNullable(mapper.readValue(bytes, SessionSnapshot.class));
        } catch (IOException e) {
            log.warn("存档解析失败，按损坏处理: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
