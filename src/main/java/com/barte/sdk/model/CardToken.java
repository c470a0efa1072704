package com.barte.sdk.model;

import com.barte.sdk.decode.DecodingException;
import com.barte.sdk.decode.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;

/** Tokenized card returned by {@code POST /cards}. Read-only once created. */
public final class CardToken {
    public final String uuid;
    public final String status;
    public final OffsetDateTime createdAt;
    public final String brand;
    public final String cardHolderName;
    public final boolean cvvChecked;
    public final String fingerprint;
    public final String first6digits;
    public final String last4digits;
    public final String buyerId;
    public final String expirationMonth;
    public final String expirationYear;
    public final String cardId;

    private CardToken(JsonFields f) throws DecodingException {
        this.uuid = f.requireText("uuid");
        this.status = f.requireText("status");
        this.createdAt = f.requireTimestamp("createdAt");
        this.brand = f.requireText("brand");
        this.cardHolderName = f.requireText("cardHolderName");
        this.cvvChecked = f.requireBoolean("cvvChecked");
        this.fingerprint = f.requireText("fingerprint");
        this.first6digits = f.requireText("first6digits");
        this.last4digits = f.requireText("last4digits");
        this.buyerId = f.requireText("buyerId");
        this.expirationMonth = f.requireText("expirationMonth");
        this.expirationYear = f.requireText("expirationYear");
        this.cardId = f.requireText("cardId");
    }

    public static CardToken decode(JsonNode node) throws DecodingException {
        return new CardToken(JsonFields.of(node));
    }
}
