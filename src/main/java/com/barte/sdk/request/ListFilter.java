package com.barte.sdk.request;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Query parameters of a paginated listing. An empty filter requests the first unfiltered page. */
public abstract class ListFilter<F extends ListFilter<F>> {

    private final Map<String, String> params = new LinkedHashMap<>();

    public F page(int page) {
        return param("page", page);
    }

    public F size(int size) {
        return param("size", size);
    }

    /** Sort descriptor such as {@code "createdAt,desc"}. */
    public F sort(String sort) {
        return param("sort", sort);
    }

    /** Sets any parameter by name; a {@code null} value removes it. */
    public F param(String name, Object value) {
        if (value == null) {
            params.remove(name);
        } else {
            params.put(name, String.valueOf(value));
        }
        return self();
    }

    public boolean isEmpty() {
        return params.isEmpty();
    }

    public Map<String, String> toQuery() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    protected abstract F self();
}
