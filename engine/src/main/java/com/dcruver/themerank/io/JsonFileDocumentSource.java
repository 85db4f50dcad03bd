package com.dcruver.themerank.io;

import com.dcruver.themerank.domain.Document;
import com.dcruver.themerank.nlp.KeywordSet;
import com.dcruver.themerank.pipeline.RunRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads posts from a JSON file: either an array of post objects or an object
 * with a {@code posts} array.
 *
 * Text comes from {@code text}, {@code content} or {@code title} plus
 * {@code selftext}. Posts without text and repeated ids are skipped. When the
 * run names communities, only posts from those communities are kept.
 */
@Component
@Slf4j
public class JsonFileDocumentSource implements DocumentSource {

    private final ObjectMapper objectMapper;
    private final int maxDocuments;

    public JsonFileDocumentSource(ObjectMapper objectMapper,
                                  @Value("${themerank.source.max-documents:5000}") int maxDocuments) {
        this.objectMapper = objectMapper;
        this.maxDocuments = maxDocuments;
    }

    @Override
    public List<Document> fetch(RunRequest request, KeywordSet keywords) throws IOException {
        if (request.source() == null || request.source().isBlank()) {
            throw new IOException("No document source given for run " + request.key());
        }

        Path path = Path.of(request.source());
        if (!Files.isRegularFile(path)) {
            throw new IOException("Document source not found: " + path);
        }

        JsonNode root = objectMapper.readTree(path.toFile());
        JsonNode posts = root.isArray() ? root : root.path("posts");
        if (!posts.isArray()) {
            throw new IOException("Expected a JSON array of posts in " + path);
        }

        Set<String> communities = new HashSet<>();
        for (String community : keywords.communities()) {
            communities.add(community.toLowerCase(Locale.ROOT));
        }

        List<Document> documents = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int skipped = 0;
        int index = 0;
        for (JsonNode post : posts) {
            Document document = toDocument(post, index++);
            if (!document.isValid() || !seen.add(document.getId())) {
                skipped++;
                continue;
            }
            if (!communities.isEmpty() && (document.getCommunity() == null
                || !communities.contains(document.getCommunity().toLowerCase(Locale.ROOT)))) {
                skipped++;
                continue;
            }
            documents.add(document);
            if (documents.size() >= maxDocuments) {
                log.info("Reached document limit of {}", maxDocuments);
                break;
            }
        }

        log.info("Read {} posts from {} ({} skipped)", documents.size(), path, skipped);
        return documents;
    }

    private Document toDocument(JsonNode post, int index) {
        String id = text(post, "id");
        return Document.builder()
            .id(id != null ? id : "post-" + index)
            .text(postText(post))
            .community(firstNonNull(text(post, "subreddit"), text(post, "community")))
            .url(firstNonNull(text(post, "url"), text(post, "permalink")))
            .createdAt(createdAt(post))
            .score(post.path("score").asDouble(0.0))
            .build();
    }

    private static String postText(JsonNode post) {
        String text = firstNonNull(text(post, "text"), text(post, "content"));
        if (text != null) {
            return text;
        }
        String title = text(post, "title");
        String body = firstNonNull(text(post, "selftext"), text(post, "body"));
        if (title == null) {
            return body;
        }
        return body == null ? title : title + "\n" + body;
    }

    private static Instant createdAt(JsonNode post) {
        JsonNode epoch = post.get("created_utc");
        if (epoch != null && epoch.isNumber()) {
            return Instant.ofEpochSecond(epoch.asLong());
        }
        String iso = text(post, "created_at");
        if (iso != null) {
            try {
                return Instant.parse(iso);
            } catch (DateTimeParseException e) {
                log.debug("Unparseable created_at '{}'", iso);
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}
