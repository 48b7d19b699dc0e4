package com.apiflow.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * What a call produced: either a single decoded value, or a single-pass iterator over the
 * elements of a paginated collection.
 */
public final class CallResult {

    private final JsonNode value;
    private final Iterator<JsonNode> elements;

    private CallResult(JsonNode value, Iterator<JsonNode> elements) {
        this.value = value;
        this.elements = elements;
    }

    public static CallResult ofValue(JsonNode value) {
        return new CallResult(value, null);
    }

    public static CallResult ofElements(Iterator<JsonNode> elements) {
        return new CallResult(null, elements);
    }

    public boolean isIterable() {
        return elements != null;
    }

    /**
     * The raw value of a non-iterated call.
     *
     * @throws IllegalStateException if the result is an iterator
     */
    public JsonNode value() {
        if (elements != null) {
            throw new IllegalStateException("Result is an element iterator, not a single value");
        }
        return value;
    }

    /**
     * The element iterator of an iterated call.
     *
     * @throws IllegalStateException if the result is a single value
     */
    public Iterator<JsonNode> elements() {
        if (elements == null) {
            throw new IllegalStateException("Result is a single value, not an element iterator");
        }
        return elements;
    }

    /**
     * Streams the elements, treating a single value as a one-element stream. Consumes the iterator.
     */
    public Stream<JsonNode> stream() {
        if (elements == null) {
            return value == null || value.isMissingNode() ? Stream.empty() : Stream.of(value);
        }
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(elements, Spliterator.ORDERED), false);
    }

    public List<JsonNode> toList() {
        return stream().toList();
    }
}
