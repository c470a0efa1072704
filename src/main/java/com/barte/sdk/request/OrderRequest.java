package com.barte.sdk.request;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Body of {@code POST /orders}.
 *
 * <p>{@link #idempotencyKey} is mandatory: the server uses it to recognise a
 * repeated submission of the same order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderRequest {
    public LocalDate startDate;
    public BigDecimal value;
    public Integer installments;
    public String title;
    public String description;
    public String attemptReference;
    public OrderPayment payment;
    /** Existing buyer; alternative to {@link #customer}. */
    public String uuidBuyer;
    public CustomerPayload customer;
    public String idempotencyKey;

    /** Default constructor for Jackson. */
    public OrderRequest() {}

    /** Constructor with required fields. */
    public OrderRequest(LocalDate startDate, BigDecimal value, int installments, String title,
                        OrderPayment payment, String idempotencyKey) {
        this.startDate = startDate;
        this.value = value;
        this.installments = installments;
        this.title = title;
        this.payment = payment;
        this.idempotencyKey = idempotencyKey;
    }
}
