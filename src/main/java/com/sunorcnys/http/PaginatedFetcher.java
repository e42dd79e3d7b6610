package com.sunorcnys.http;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks a paginated list endpoint lazily. Every {@link Iterable#iterator()} starts over from the first page,
 * so the returned sequence can be drained more than once.
 */
public class PaginatedFetcher {

    private static final Logger log = LoggerFactory.getLogger(PaginatedFetcher.class);
    public static final int DEFAULT_MAX_PAGES = 1000;

    private final String service;
    private final int maxPages;

    public PaginatedFetcher(String service) {
        this(service, DEFAULT_MAX_PAGES);
    }

    public PaginatedFetcher(String service, int maxPages) {
        this.service = service;
        this.maxPages = Math.max(1, maxPages);
    }

    /**
     * Loads one page. Implementations go through a {@link RetryingExecutor}.
     */
    @FunctionalInterface
    public interface PageLoader {
        ApiResponse load(URI uri);
    }

    /**
     * @param extractItems returns the page's item array
     * @param extractNext  returns the next page URL, absolute or relative to the current one
     */
    public Iterable<JsonNode> fetchAll(URI start,
                                       PageLoader loader,
                                       Function<JsonNode, JsonNode> extractItems,
                                       Function<JsonNode, Optional<String>> extractNext) {
        return () -> new PageIterator(start, loader, extractItems, extractNext);
    }

    public Iterable<JsonNode> fetchAll(URI start,
                                       RetryingExecutor executor,
                                       Function<URI, ApiRequest> requestFactory,
                                       Function<JsonNode, JsonNode> extractItems,
                                       Function<JsonNode, Optional<String>> extractNext) {
        return fetchAll(start, uri -> executor.execute(requestFactory.apply(uri), "fetch-page"), extractItems, extractNext);
    }

    public static Stream<JsonNode> stream(Iterable<JsonNode> pages) {
        return StreamSupport.stream(pages.spliterator(), false);
    }

    private final class PageIterator implements Iterator<JsonNode> {

        private final PageLoader loader;
        private final Function<JsonNode, JsonNode> extractItems;
        private final Function<JsonNode, Optional<String>> extractNext;
        private final Set<URI> visited = new HashSet<>();
        private Iterator<JsonNode> current = Collections.emptyIterator();
        private URI next;
        private int pages;

        private PageIterator(URI start,
                             PageLoader loader,
                             Function<JsonNode, JsonNode> extractItems,
                             Function<JsonNode, Optional<String>> extractNext) {
            this.next = start;
            this.loader = loader;
            this.extractItems = extractItems;
            this.extractNext = extractNext;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext() && next != null) {
                loadPage(next);
            }
            return current.hasNext();
        }

        @Override
        public JsonNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }

        private void loadPage(URI uri) {
            if (!visited.add(uri)) {
                throw new FetchException(service, "fetch-page", "Pagination loops back to " + uri);
            }
            if (++pages > maxPages) {
                throw new FetchException(service, "fetch-page", "Pagination exceeded " + maxPages + " pages at " + uri);
            }
            ApiResponse response = loader.load(uri);
            if (!response.isSuccess()) {
                throw new FetchException(service, "fetch-page",
                        "Page " + pages + " (" + uri + ") failed with status " + response.status() + ": " + response.bodySnippet(),
                        response.status(), null);
            }
            JsonNode body = response.body();
            JsonNode items = body.isObject() ? extractItems.apply(body) : null;
            if (items == null || !items.isArray()) {
                throw new FetchException(service, "fetch-page", "Malformed page " + pages + " from " + uri + ": no item array");
            }
            current = items.elements();
            next = extractNext.apply(body)
                    .filter(s -> !s.isBlank())
                    .map(link -> resolve(uri, link))
                    .orElse(null);
            log.debug("{} page {} with {} items, next={}", service, pages, items.size(), next);
        }

        private URI resolve(URI current, String link) {
            // cursor links carry raw brackets, e.g. page[cursor]=...
            String escaped = link.replace("[", "%5B").replace("]", "%5D").replace(" ", "%20");
            try {
                return current.resolve(escaped);
            } catch (IllegalArgumentException e) {
                throw new FetchException(service, "fetch-page", "Malformed next link '" + link + "'", -1, e);
            }
        }
    }
}
