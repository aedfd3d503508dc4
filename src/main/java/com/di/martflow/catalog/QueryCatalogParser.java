package com.di.martflow.catalog;

import com.di.martflow.exception.DuplicateQueryNameException;
import com.di.martflow.exception.MalformedCatalogException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses a catalog document of named statements.
 *
 * <pre>
 * -- name: revenue_by_country
 * SELECT ...;
 *
 * -- name: rolling_revenue
 * WITH daily AS (...) SELECT ...;
 * </pre>
 *
 * A line whose trimmed text starts with {@value #MARKER_PREFIX} opens a block and closes the
 * previous one. Everything up to the next marker belongs to the block verbatim, comments and
 * blank lines included. Text before the first marker must be blank.
 */
@Slf4j
@Component
public class QueryCatalogParser {

    public static final String MARKER_PREFIX = "-- name:";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * @throws DuplicateQueryNameException when two markers share an identifier
     * @throws MalformedCatalogException   on non-blank text before the first marker or an
     *                                     invalid identifier
     */
    public QueryCatalog parse(String document) {
        List<QueryDefinition> definitions = new ArrayList<>();
        Map<String, Integer> markerLines = new HashMap<>();

        String currentName = null;
        int currentLine = 0;
        StringBuilder block = new StringBuilder();
        int firstTextLine = 0;

        int pos = 0;
        int lineNo = 0;
        String doc = document == null ? "" : document;
        while (pos < doc.length()) {
            int nl = doc.indexOf('\n', pos);
            int end = nl < 0 ? doc.length() : nl + 1;
            String line = doc.substring(pos, end);
            pos = end;
            lineNo++;

            String content = stripTerminator(line);
            if (isMarker(content)) {
                if (currentName != null) {
                    definitions.add(new QueryDefinition(currentName, block.toString(), definitions.size(), currentLine));
                } else if (firstTextLine > 0) {
                    throw new MalformedCatalogException(firstTextLine, "text before the first '" + MARKER_PREFIX + "' marker");
                }
                currentName = identifierOf(content, lineNo);
                Integer first = markerLines.putIfAbsent(currentName, lineNo);
                if (first != null) {
                    throw new DuplicateQueryNameException(currentName, first, lineNo);
                }
                currentLine = lineNo;
                block.setLength(0);
            } else if (currentName == null) {
                if (firstTextLine == 0 && !content.isBlank()) {
                    firstTextLine = lineNo;
                }
            } else {
                block.append(line);
            }
        }

        if (currentName != null) {
            definitions.add(new QueryDefinition(currentName, block.toString(), definitions.size(), currentLine));
        } else if (firstTextLine > 0) {
            throw new MalformedCatalogException(firstTextLine, "no '" + MARKER_PREFIX + "' marker in a non-blank document");
        }

        for (QueryDefinition d : definitions) {
            if (d.isBlank()) {
                log.warn("[CATALOG] query '{}' (line {}) has an empty statement", d.name(), d.lineNumber());
            }
        }
        log.debug("[CATALOG] parsed {} quer(ies): {}", definitions.size(), markerLines.keySet());
        return new QueryCatalog(definitions);
    }

    static boolean isMarker(String content) {
        return content.strip().startsWith(MARKER_PREFIX);
    }

    private static String identifierOf(String content, int lineNo) {
        String stripped = content.strip();
        String name = stripped.substring(stripped.indexOf(':') + 1).strip();
        if (name.isEmpty()) {
            throw new MalformedCatalogException(lineNo, "marker without a query name");
        }
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new MalformedCatalogException(lineNo, "invalid query name '" + name + "'");
        }
        return name;
    }

    private static String stripTerminator(String line) {
        int end = line.length();
        if (end > 0 && line.charAt(end - 1) == '\n') end--;
        if (end > 0 && line.charAt(end - 1) == '\r') end--;
        return line.substring(0, end);
    }
}
