package com.barte.sdk.request;

import com.barte.sdk.model.ChargeStatus;
import com.barte.sdk.model.PaymentMethod;

import java.time.LocalDate;

/** Filters for {@code GET /charges}. */
public final class ChargeFilter extends ListFilter<ChargeFilter> {

    public static ChargeFilter create() {
        return new ChargeFilter();
    }

    public ChargeFilter customerDocument(String document) {
        return param("customerDocument", document);
    }

    public ChargeFilter status(ChargeStatus status) {
        return param("status", status == null ? null : status.name());
    }

    public ChargeFilter paymentMethod(PaymentMethod method) {
        return param("paymentMethod", method == null ? null : method.name());
    }

    public ChargeFilter orderUuid(String orderUuid) {
        return param("orderUuid", orderUuid);
    }

    public ChargeFilter expirationDateInitial(LocalDate date) {
        return param("expirationDateInitial", date);
    }

    public ChargeFilter expirationDateFinal(LocalDate date) {
        return param("expirationDateFinal", date);
    }

    @Override
    protected ChargeFilter self() {
        return this;
    }
}
