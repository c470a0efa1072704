package com.barte.sdk.request;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Body of {@code POST /buyers}. The uuid is assigned by the server. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BuyerRequest {
    public String document;
    public String name;
    public String countryCode;
    public String phone;
    public String email;
    public String alternativeEmail;

    /** Default constructor for Jackson. */
    public BuyerRequest() {}

    /** Constructor with required fields. */
    public BuyerRequest(String document, String name, String email, String phone) {
        this.document = document;
        this.name = name;
        this.email = email;
        this.phone = phone;
    }
}
