package com.lexhub.gameservice.games.letterfall.infrastructure.lexicon;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 从 classpath 读取按行组织的文本资源（词表、屏蔽词、释义）。
 * 空行和以 '#' 开头的行忽略；资源不存在或读取失败时记 WARN 并返回空列表。
 */
@Slf4j
public final class ClasspathWordList {

    private ClasspathWordList() {}

    public static List<String> readLines(String location) {
        Resource res = new ClassPathResource(stripPrefix(location));
        if (!res.exists()) {
            log.warn("词表资源不存在，按空集合处理: {}", location);
            return List.of();
        }
        List<String> out = new ArrayList<>();
        try (BufferedReader r = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                String t = line.trim();
                if (t.isEmpty() || t.startsWith("#")) continue;
                out.add(t);
            }
        } catch (IOException e) {
            log.warn("读取词表失败，按空集合处理: {} ({})", location, e.getMessage());
            return List.of();
        }
        log.info("已加载 {} 行: {}", out.size(), location);
        return out;
    }

    private static String stripPrefix(String location) {
        return location.startsWith("classpath:") ? location.substring("classpath:".length()) : location;
    }
}
