package com.barte.sdk.model;

import com.barte.sdk.client.BarteClient;
import com.barte.sdk.decode.DecodingException;
import com.barte.sdk.decode.Field;
import com.barte.sdk.decode.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Outcome of {@code PATCH /charges/{uuid}/refund}. The server answers with the
 * refunded charge, which is kept in {@link #charge}.
 */
public final class Refund {
    public final String chargeUuid;
    public final BigDecimal value;
    public final ChargeStatus status;
    public final Field<OffsetDateTime> createdAt;
    public final Charge charge;

    private Refund(JsonFields f, BarteClient client) throws DecodingException {
        this.charge = Charge.decode(f, client);
        this.chargeUuid = charge.uuid;
        this.value = charge.value;
        this.status = charge.status;
        Field<OffsetDateTime> refundDate = f.optionalTimestamp("refundDate");
        this.createdAt = refundDate.isPresent() ? refundDate : f.optionalTimestamp("createdAt");
    }

    public static Refund decode(JsonNode node) throws DecodingException {
        return decode(node, null);
    }

    public static Refund decode(JsonNode node, BarteClient client) throws DecodingException {
        return decode(JsonFields.of(node), client);
    }

    /** Decodes one element of a refund list. */
    public static Refund decode(JsonFields fields, BarteClient client) throws DecodingException {
        return new Refund(fields, client);
    }
}
