package com.barte.sdk.request;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Body of {@code POST /cards}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CardTokenRequest {
    public String holderName;
    public String number;
    public String cvv;
    /** {@code MM/YYYY}. */
    public String expiration;
    public String buyerUuid;

    /** Default constructor for Jackson. */
    public CardTokenRequest() {}

    public CardTokenRequest(String holderName, String number, String cvv, int expirationMonth,
                            int expirationYear, String buyerUuid) {
        if (expirationMonth < 1 || expirationMonth > 12) {
            throw new IllegalArgumentException("expirationMonth must be 1-12 but was " + expirationMonth);
        }
        this.holderName = holderName;
        this.number = number;
        this.cvv = cvv;
        this.expiration = String.format("%02d/%04d", expirationMonth, expirationYear);
        this.buyerUuid = buyerUuid;
    }

    @Override
    public String toString() {
        // card number and cvv stay out of logs
        return "CardTokenRequest{holderName=" + holderName + ", expiration=" + expiration + ", buyerUuid=" + buyerUuid + "}";
    }
}
