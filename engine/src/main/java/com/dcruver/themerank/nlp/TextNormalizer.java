package com.dcruver.themerank.nlp;

import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Canonicalizes post text so trivially different spellings share a cache key,
 * and derives the stable content hashes used as cache keys.
 */
@Component
public class TextNormalizer {

    private static final int HASH_LENGTH = 16;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern DISALLOWED = Pattern.compile("[^\\w\\s.!?]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern REPEATED_TERMINAL = Pattern.compile("([.!?])\\1+");

    private static final Map<Pattern, String> CONTRACTIONS = new LinkedHashMap<>();

    static {
        String[][] pairs = {
            {"i'm", "i am"}, {"can't", "cannot"}, {"won't", "will not"}, {"don't", "do not"},
            {"it's", "it is"}, {"that's", "that is"}, {"you're", "you are"}, {"we're", "we are"},
            {"doesn't", "does not"}, {"didn't", "did not"}, {"isn't", "is not"}, {"aren't", "are not"},
            {"haven't", "have not"}, {"hasn't", "has not"}, {"hadn't", "had not"},
            {"couldn't", "could not"}, {"wouldn't", "would not"}, {"shouldn't", "should not"}
        };
        for (String[] pair : pairs) {
            CONTRACTIONS.put(
                Pattern.compile("\\b" + Pattern.quote(pair[0]) + "\\b", Pattern.UNICODE_CHARACTER_CLASS),
                pair[1]);
        }
    }

    /**
     * Lower-case, expand common contractions, strip punctuation other than
     * terminal . ! ? and collapse whitespace. Idempotent.
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String result = WHITESPACE.matcher(text.toLowerCase().trim()).replaceAll(" ");

        for (Map.Entry<Pattern, String> contraction : CONTRACTIONS.entrySet()) {
            result = contraction.getKey().matcher(result).replaceAll(contraction.getValue());
        }

        result = DISALLOWED.matcher(result).replaceAll(" ");
        result = WHITESPACE.matcher(result).replaceAll(" ").trim();
        if (result.isEmpty()) {
            return "";
        }

        return REPEATED_TERMINAL.matcher(result).replaceAll("$1");
    }

    /**
     * Stable digest of the raw text (truncated SHA-256 hex)
     */
    public String contentHash(String text) {
        return DigestUtils.sha256Hex(text == null ? "" : text).substring(0, HASH_LENGTH);
    }

    /**
     * Digest of the normalized form of the text
     */
    public String normalizedHash(String text) {
        return contentHash(normalize(text));
    }
}
