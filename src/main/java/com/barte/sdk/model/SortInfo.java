package com.barte.sdk.model;

import com.barte.sdk.decode.DecodingException;
import com.barte.sdk.decode.JsonFields;

/** Sort descriptor of a {@link Page}. */
public final class SortInfo {
    public final boolean sorted;
    public final boolean unsorted;
    public final boolean empty;

    private SortInfo(JsonFields f) throws DecodingException {
        this.sorted = f.requireBoolean("sorted");
        this.unsorted = f.requireBoolean("unsorted");
        this.empty = f.requireBoolean("empty");
    }

    static SortInfo decode(JsonFields fields) throws DecodingException {
        return new SortInfo(fields);
    }
}
