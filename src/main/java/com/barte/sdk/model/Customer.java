package com.barte.sdk.model;

import com.barte.sdk.decode.DecodingException;
import com.barte.sdk.decode.Field;
import com.barte.sdk.decode.JsonFields;

/** Snapshot of the paying customer embedded in charges and orders. */
public final class Customer {
    public final Field<String> uuid;
    public final String document;
    public final Field<String> type;               // e.g. "CPF", "CNPJ"
    public final Field<String> documentCountry;
    public final String name;
    public final String email;
    public final String phone;
    public final Field<String> alternativeEmail;

    private Customer(JsonFields f) throws DecodingException {
        this.uuid = f.optionalText("uuid");
        this.document = f.requireText("document");
        this.type = f.optionalText("type");
        this.documentCountry = f.optionalText("documentCountry");
        this.name = f.requireText("name");
        this.email = f.requireText("email");
        this.phone = f.requireText("phone");
        this.alternativeEmail = f.optionalText("alternativeEmail");
    }

    public static Customer decode(JsonFields fields) throws DecodingException {
        return new Customer(fields);
    }
}
