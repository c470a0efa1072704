package com.barte.sdk.model;

import com.barte.sdk.decode.DecodingException;
import com.barte.sdk.decode.Field;
import com.barte.sdk.decode.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;

/** A buyer registered with the API, returned by {@code POST /buyers} and {@code GET /buyers}. */
public final class Buyer {
    public final String uuid;
    public final String document;
    public final String name;
    public final Field<String> countryCode;
    public final String phone;
    public final String email;
    public final Field<String> alternativeEmail;

    private Buyer(JsonFields f) throws DecodingException {
        this.uuid = f.requireText("uuid");
        this.document = f.requireText("document");
        this.name = f.requireText("name");
        this.countryCode = f.optionalText("countryCode");
        this.phone = f.requireText("phone");
        this.email = f.requireText("email");
        this.alternativeEmail = f.optionalText("alternativeEmail");
    }

    public static Buyer decode(JsonFields fields) throws DecodingException {
        return new Buyer(fields);
    }

    public static Buyer decode(JsonNode node) throws DecodingException {
        return decode(JsonFields.of(node));
    }
}
