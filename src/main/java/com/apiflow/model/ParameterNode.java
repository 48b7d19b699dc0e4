package com.apiflow.model;

/**
 * A single method parameter as declared by the interface document.
 *
 * @param name     The parameter name.
 * @param type     The primitive type, e.g. {@code string}, {@code integer}, {@code boolean}.
 * @param format   Optional format hint, e.g. {@code int64}.
 * @param location {@code path} or {@code query}.
 * @param required Whether the call fails without it.
 * @param repeated Whether multiple values are accepted.
 */
public record ParameterNode(String name, String type, String format, String location, boolean required, boolean repeated) {

    public boolean inPath() {
        return "path".equals(location);
    }
}
