package com.apiflow.exception;

import java.util.List;
import lombok.Getter;

/**
 * Raised when a dot-path cannot be resolved against a service's method tree.
 * The message lists the segments that were valid at the point of failure.
 */
@Getter
public class MethodNotFoundException extends ApiFlowException {

    private final String dotPath;
    private final String segment;
    private final List<String> validSegments;

    public MethodNotFoundException(String serviceId, String dotPath, String segment, List<String> validSegments) {
        super("Method '" + dotPath + "' not found in API '" + serviceId + "': no segment '" + segment
                + "', valid next segments are " + validSegments);
        this.dotPath = dotPath;
        this.segment = segment;
        this.validSegments = List.copyOf(validSegments);
    }
}
