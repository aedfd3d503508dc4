package com.di.martflow.catalog;

import com.di.martflow.config.MartFlowProperties;
import com.di.martflow.exception.MalformedCatalogException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Loads the configured catalog document ({@code martflow.catalog.location}) and parses it.
 * The document is re-read on every call; definitions never outlive a run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryCatalogLoader {

    private final ResourceLoader resourceLoader;
    private final QueryCatalogParser parser;
    private final MartFlowProperties properties;

    public QueryCatalog load() {
        String location = properties.getCatalog().getLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new MalformedCatalogException("catalog document not found at '" + location + "'", null);
        }
        String document;
        try (InputStream in = resource.getInputStream()) {
            document = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MalformedCatalogException("cannot read catalog document '" + location + "': " + e.getMessage(), e);
        }
        QueryCatalog catalog = parser.parse(document);
        log.info("[CATALOG] loaded {} quer(ies) from {}: {}", catalog.size(), location, catalog.names());
        return catalog;
    }
}
