package com.apiflow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Flattens a sequence of paginated responses into a single-pass stream of elements.
 * <p>
 * The page of items is the first array-valued field of a response. When the current page runs
 * out, its {@code nextPageToken} is handed to the page fetcher for the following page; without a
 * token the iterator is exhausted. A first response without any array field or continuation token
 * is a single element, so methods that return either one object or a collection can be iterated
 * alike.
 * <p>
 * Not safe for concurrent use; each iterator has one owner and cannot be restarted.
 */
@Slf4j
public class PageIterator implements Iterator<JsonNode> {

    public static final String NEXT_PAGE_TOKEN = "nextPageToken";

    /**
     * Fields that describe a collection envelope rather than data.
     */
    private static final Set<String> ENVELOPE_FIELDS = Set.of("kind", "etag", NEXT_PAGE_TOKEN, "totalSize", "totalCount");

    private final Function<String, JsonNode> pageFetcher;
    private final Integer limit;

    private JsonNode page;
    private String itemsField;
    private boolean singleElement;
    private int position;
    private int count;
    private boolean exhausted;
    private Long totalCount;

    /**
     * @param pageFetcher Fetches a page given its continuation token, {@code null} for the first page.
     * @param firstPage   The already fetched first page, or {@code null} to fetch it lazily.
     * @param limit       Maximum number of elements to yield, {@code null} for no limit.
     */
    public PageIterator(Function<String, JsonNode> pageFetcher, JsonNode firstPage, Integer limit) {
        this.pageFetcher = pageFetcher;
        this.limit = limit;
        if (firstPage != null) {
            load(firstPage, true);
        }
    }

    @Override
    public boolean hasNext() {
        if (exhausted) {
            return false;
        }
        if (limit != null && count >= limit) {
            return finish();
        }
        if (page == null) {
            load(pageFetcher.apply(null), true);
        }
        while (true) {
            if (page == null || page.isMissingNode() || page.isNull()) {
                return finish();
            }
            if (singleElement) {
                return position == 0 || finish();
            }
            if (position < itemCount()) {
                return true;
            }
            String token = page.path(NEXT_PAGE_TOKEN).textValue();
            if (token == null || token.isEmpty()) {
                return finish();
            }
            log.debug("Fetching next page after {} elements", count);
            load(pageFetcher.apply(token), false);
        }
    }

    @Override
    public JsonNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Paginated results exhausted after " + count + " elements");
        }
        JsonNode value = singleElement ? page : items().get(position);
        position++;
        count++;
        return value;
    }

    /**
     * The total reported by the most recent page ({@code totalSize} or {@code totalCount}), if any.
     */
    public OptionalLong totalCount() {
        return totalCount == null ? OptionalLong.empty() : OptionalLong.of(totalCount);
    }

    private void load(JsonNode response, boolean first) {
        page = response;
        position = 0;
        if (response == null) {
            return;
        }
        String found = findItemsField(response);
        if (found != null) {
            itemsField = found;
        }
        // a first response without any collection is the result itself
        singleElement = first && itemsField == null && !response.isArray() && !hasToken(response) && isElement(response);
        for (String field : new String[]{"totalSize", "totalCount"}) {
            JsonNode total = response.path(field);
            if (total.isNumber() || (total.isTextual() && total.asText().matches("\\d+"))) {
                totalCount = total.asLong();
            }
        }
    }

    private JsonNode items() {
        if (page.isArray()) {
            return page;
        }
        return itemsField == null ? null : page.get(itemsField);
    }

    private int itemCount() {
        JsonNode items = items();
        return items == null || !items.isArray() ? 0 : items.size();
    }

    private boolean finish() {
        exhausted = true;
        return false;
    }

    private static boolean hasToken(JsonNode response) {
        String token = response.path(NEXT_PAGE_TOKEN).textValue();
        return token != null && !token.isEmpty();
    }

    private static String findItemsField(JsonNode response) {
        if (!response.isObject()) {
            return null;
        }
        for (Iterator<Map.Entry<String, JsonNode>> fields = response.fields(); fields.hasNext(); ) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isArray()) {
                return field.getKey();
            }
        }
        return null;
    }

    private static boolean isElement(JsonNode response) {
        if (!response.isObject()) {
            return !response.isNull() && !response.isMissingNode();
        }
        for (Iterator<String> names = response.fieldNames(); names.hasNext(); ) {
            if (!ENVELOPE_FIELDS.contains(names.next())) {
                return true;
            }
        }
        log.warn("Response carries no collection and no data fields: {}", response);
        return false;
    }
}
