package com.barte.sdk.model;

import com.barte.sdk.decode.DecodingException;
import com.barte.sdk.decode.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** Result of an installment simulation, ordered as returned by the server. */
public final class InstallmentOptions {
    public final List<InstallmentOption> installments;

    private InstallmentOptions(List<InstallmentOption> installments) {
        this.installments = installments;
    }

    public static InstallmentOptions decode(JsonNode node) throws DecodingException {
        return new InstallmentOptions(JsonFields.of(node).requireList("installments", InstallmentOption::decode));
    }
}
