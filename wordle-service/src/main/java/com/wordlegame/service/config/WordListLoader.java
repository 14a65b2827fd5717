package com.wordlegame.service.config;

import com.wordlegame.engine.WordFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads one-word-per-line lists from classpath or file locations.
 */
@Slf4j
@Component
public class WordListLoader {

    private final ResourceLoader resourceLoader;

    public WordListLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * Load a list, keeping only lines that are five letters a-z once trimmed and lower-cased.
     */
    public List<String> load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Word list not found: " + location);
        }

        List<String> words = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String word = line.trim().toLowerCase(Locale.ROOT);
                if (word.isEmpty()) {
                    continue;
                }
                if (WordFormat.isValid(word, WordFormat.DEFAULT_LENGTH)) {
                    words.add(word);
                } else {
                    skipped++;
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read word list " + location, e);
        }

        if (skipped > 0) {
            log.warn("Skipped {} malformed entries in {}", skipped, location);
        }
        return words;
    }
}
