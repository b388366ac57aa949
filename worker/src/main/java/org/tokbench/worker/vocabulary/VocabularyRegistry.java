package org.tokbench.worker.vocabulary;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.tokbench.common.Language;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Loads every configured vocabulary once, at startup.
 * <p>
 * Plain text files hold one word per line with {@code #} comments. CSV files use the
 * first column and may start with a {@code Words} header.
 */
@Component
@Slf4j
public class VocabularyRegistry {

    private static final String CSV_HEADER = "words";

    private final Map<Language, GroundTruthVocabulary> vocabularies = new EnumMap<>(Language.class);

    public VocabularyRegistry(VocabularyProperties properties, ResourceLoader resourceLoader) {
        properties.getLocations().forEach((code, location) -> {
            Language language = Language.fromCode(code);
            Resource resource = resourceLoader.getResource(location);
            GroundTruthVocabulary vocabulary = GroundTruthVocabulary.of(language, loadWords(resource));
            vocabularies.put(language, vocabulary);
            log.info("Loaded {} vocabulary: {} words from {}", language.code(), vocabulary.size(), location);
        });
    }

    public Optional<GroundTruthVocabulary> find(Language language) {
        return Optional.ofNullable(vocabularies.get(language));
    }

    public GroundTruthVocabulary get(Language language) {
        return find(language).orElseThrow(() -> new IllegalStateException(
                "No vocabulary configured for " + language.code()
                        + ", set tokbench.vocabulary.locations." + language.code()));
    }

    public void register(GroundTruthVocabulary vocabulary) {
        vocabularies.put(vocabulary.getLanguage(), vocabulary);
    }

    static List<String> loadWords(Resource resource) {
        boolean csv = resource.getFilename() != null
                && resource.getFilename().toLowerCase(Locale.ROOT).endsWith(".csv");
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            return reader.lines()
                    .map(line -> csv ? firstCsvColumn(line) : stripComment(line))
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .filter(line -> !csv || !line.equalsIgnoreCase(CSV_HEADER))
                    .toList();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load vocabulary from " + resource, e);
        }
    }

    private static String stripComment(String line) {
        int commentIdx = line.indexOf('#');
        return commentIdx >= 0 ? line.substring(0, commentIdx) : line;
    }

    private static String firstCsvColumn(String line) {
        String trimmed = line.trim();
        if (trimmed.startsWith("\"")) {
            StringBuilder field = new StringBuilder();
            for (int i = 1; i < trimmed.length(); i++) {
                char c = trimmed.charAt(i);
                if (c == '"') {
                    if (i + 1 < trimmed.length() && trimmed.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                        continue;
                    }
                    break;
                }
                field.append(c);
            }
            return field.toString();
        }
        int comma = trimmed.indexOf(',');
        return comma >= 0 ? trimmed.substring(0, comma) : trimmed;
    }
}
