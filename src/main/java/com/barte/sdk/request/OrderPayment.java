package com.barte.sdk.request;

import com.barte.sdk.model.PaymentMethod;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/** Payment section of an {@link OrderRequest}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderPayment {
    public PaymentMethod method;

    /** Card brand, e.g. "visa"; card payments only. */
    public String brand;

    /** Token from {@code POST /cards}; card payments only. */
    public String cardToken;

    public Boolean capture;

    public String integrationOrderId;

    /** {@code true} passes installment fees to the customer, {@code false} keeps them with the merchant. */
    public Boolean splitFee;

    public Boolean recurring;

    /** Anti-fraud data, forwarded as is. */
    public Map<String, Object> fraudData;

    /** Default constructor for Jackson. */
    public OrderPayment() {}

    public OrderPayment(PaymentMethod method) {
        this.method = method;
    }

    public static OrderPayment pix() {
        return new OrderPayment(PaymentMethod.PIX);
    }

    public static OrderPayment bankSlip() {
        return new OrderPayment(PaymentMethod.BANK_SLIP);
    }

    /** Captured credit-card payment with a previously created card token. */
    public static OrderPayment creditCard(String cardToken) {
        OrderPayment payment = new OrderPayment(PaymentMethod.CREDIT_CARD);
        payment.cardToken = cardToken;
        payment.capture = true;
        return payment;
    }

    public static OrderPayment recurringCreditCard(String cardToken) {
        OrderPayment payment = creditCard(cardToken);
        payment.recurring = true;
        return payment;
    }

    /** Installment card payment whose fees are paid by the customer. */
    public static OrderPayment installmentsWithFee(String cardToken) {
        OrderPayment payment = creditCard(cardToken);
        payment.splitFee = true;
        return payment;
    }

    /** Installment card payment whose fees are absorbed by the merchant. */
    public static OrderPayment installmentsWithoutFee(String cardToken) {
        OrderPayment payment = creditCard(cardToken);
        payment.splitFee = false;
        return payment;
    }
}
