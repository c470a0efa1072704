package com.barte.sdk.model;

import com.barte.sdk.decode.DecodingException;
import com.barte.sdk.decode.JsonFields;

import java.math.BigDecimal;

/** One row of an installment simulation. */
public final class InstallmentOption {
    public final int installments;
    public final BigDecimal amount;        // per installment
    public final BigDecimal total;
    public final BigDecimal interestRate;  // percent

    private InstallmentOption(JsonFields f) throws DecodingException {
        this.installments = f.requireInt("installments");
        this.amount = f.requireDecimal("amount");
        this.total = f.requireDecimal("total");
        this.interestRate = f.requireDecimal("interest_rate");
    }

    static InstallmentOption decode(JsonFields fields) throws DecodingException {
        return new InstallmentOption(fields);
    }
}
