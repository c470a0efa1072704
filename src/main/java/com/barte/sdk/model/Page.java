package com.barte.sdk.model;

import com.barte.sdk.decode.DecodingException;
import com.barte.sdk.decode.ElementDecoder;
import com.barte.sdk.decode.Field;
import com.barte.sdk.decode.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One page of a listing, shared by buyer and charge listings.
 * A page either decodes completely or not at all.
 */
public final class Page<T> {
    public final List<T> content;
    public final int pageNumber;
    public final int pageSize;
    public final long totalElements;
    public final int totalPages;
    public final Field<Integer> numberOfElements;
    public final Field<SortInfo> sort;
    public final boolean first;
    public final boolean last;
    public final boolean empty;

    private Page(JsonFields f, ElementDecoder<T> decoder) throws DecodingException {
        this.content = f.requireList("content", decoder);
        Field<JsonFields> pageable = f.optionalObject("pageable");
        if (pageable.isPresent()) {
            this.pageNumber = pageable.get().requireInt("pageNumber");
            this.pageSize = pageable.get().requireInt("pageSize");
        } else if (f.has("pageNumber")) {
            this.pageNumber = f.requireInt("pageNumber");
            this.pageSize = f.requireInt("pageSize");
        } else {
            this.pageNumber = f.requireInt("number");
            this.pageSize = f.requireInt("size");
        }
        this.totalElements = f.requireLong("totalElements");
        this.totalPages = f.requireInt("totalPages");
        this.numberOfElements = f.optionalInt("numberOfElements");
        this.sort = decodeSort(f);
        this.first = f.requireBoolean("first");
        this.last = f.requireBoolean("last");
        this.empty = f.requireBoolean("empty");
    }

    public static <T> Page<T> decode(JsonNode node, ElementDecoder<T> decoder) throws DecodingException {
        return new Page<>(JsonFields.of(node), decoder);
    }

    private static Field<SortInfo> decodeSort(JsonFields f) throws DecodingException {
        Field<JsonFields> sort = f.optionalObject("sort");
        if (!sort.isPresent()) {
            return sort.isAbsent() ? Field.absent() : Field.ofNull();
        }
        return Field.of(SortInfo.decode(sort.get()));
    }
}
