package io.stubmatch.core.model;

import java.util.LinkedHashMap;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Total parser from a URI-like string into a {@link Request}.
 *
 * <p>
 * Grammar: {@code ['/'] [path] ['?' pair ('&' pair)*] ['#' fragment]} with
 * {@code pair := key ['=' value]}.
 *
 * <ol>
 * <li>Trim Unicode white space, strip one leading {@code /}.</li>
 * <li>Split once on {@code #}; a non-empty right side is the fragment.</li>
 * <li>Split the rest once on {@code ?}; the left side is the path
 * (re-prefixed with {@code /}), the right side the query string.</li>
 * <li>Split the query on {@code &}, each pair once on {@code =}. An empty
 * or missing value makes the key a flag. Later duplicates win.</li>
 * </ol>
 *
 * <p>
 * No percent-decoding is performed. The parser never throws: any input,
 * including {@code null}, yields a valid request with the default method.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class RequestParser {

    private static final Logger LOG = LoggerFactory.getLogger(RequestParser.class);

    private RequestParser() {}

    public static Request parse(String text) {
        String input = text != null ? trim(text) : "";
        if (input.startsWith("/")) {
            input = input.substring(1);
        }

        Split hashSplit = Split.once(input, '#');
        Split querySplit = Split.once(hashSplit.head(), '?');

        Request request = new Request(
                Request.DEFAULT_METHOD,
                "/" + querySplit.head(),
                querySplit.tail().map(RequestParser::parseQuery).orElse(QueryParams.empty()),
                hashSplit.tail(),
                null,
                null);

        LOG.trace("Parsed '{}' into {}", text, request);
        return request;
    }

    /**
     * Strips Unicode white space from both ends. Unlike {@link String#strip()}
     * this also removes no-break spaces (U+00A0, U+2007, U+202F) and NEL
     * (U+0085).
     */
    static String trim(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isTrimmable(text.charAt(start))) {
            start++;
        }
        while (end > start && isTrimmable(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isTrimmable(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
    }

    static QueryParams parseQuery(String queryString) {
        LinkedHashMap<String, Optional<String>> params = new LinkedHashMap<>();
        for (String pair : queryString.split("&", -1)) {
            Split kv = Split.once(pair, '=');
            Optional<String> previous = params.put(kv.head(), kv.tail());
            if (previous != null) {
                LOG.debug("Duplicate query key '{}': {} overwritten by {}", kv.head(), previous, kv.tail());
            }
        }
        return QueryParams.of(params);
    }

    /**
     * Result of splitting once on a delimiter. {@code tail} is absent when the
     * delimiter is missing or nothing follows it.
     */
    private record Split(String head, Optional<String> tail) {

        static Split once(String input, char delimiter) {
            int at = input.indexOf(delimiter);
            if (at < 0) {
                return new Split(input, Optional.empty());
            }
            String rest = input.substring(at + 1);
            return new Split(input.substring(0, at), rest.isEmpty() ? Optional.empty() : Optional.of(rest));
        }
    }
}
