package com.barte.sdk.request;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Customer data sent inline with an order. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CustomerPayload {
    public String document;
    public String type;              // "CPF" or "CNPJ"
    public String documentCountry;   // ISO country of the document, e.g. "BR"
    public String name;
    public String email;
    public String phone;
    public String alternativeEmail;

    /** Default constructor for Jackson. */
    public CustomerPayload() {}

    /** Constructor with required fields. */
    public CustomerPayload(String document, String name, String email, String phone) {
        this.document = document;
        this.name = name;
        this.email = email;
        this.phone = phone;
    }
}
