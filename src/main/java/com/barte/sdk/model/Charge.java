package com.barte.sdk.model;

import com.barte.sdk.client.BarteClient;
import com.barte.sdk.decode.DecodingException;
import com.barte.sdk.decode.Field;
import com.barte.sdk.decode.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * A single payment attempt against a customer.
 *
 * <p>The variant is tagged by {@link #kind}: a {@link ChargeKind#PIX} charge also
 * carries {@link PixDetails}. A charge obtained from a {@link BarteClient} keeps a
 * reference to it so that {@link #refund()}, {@link #cancel()} and
 * {@link #pixQrCode()} can be called directly; a charge decoded on its own is
 * unbound until {@link #withClient(BarteClient)} is used.
 */
public final class Charge implements Refundable<Refund>, Cancelable {
    public final String uuid;
    public final String title;
    public final OffsetDateTime expirationDate;
    public final BigDecimal value;
    public final PaymentMethod paymentMethod;
    public final ChargeStatus status;
    public final Customer customer;
    public final Field<OffsetDateTime> paidDate;
    public final Field<String> authorizationCode;
    public final Field<String> authorizationNsu;
    public final Field<Integer> installments;
    public final Field<BigDecimal> installmentAmount;
    public final ChargeKind kind;

    private final PixDetails pix;
    private final BarteClient client;

    private Charge(JsonFields f, BarteClient client) throws DecodingException {
        this.uuid = f.requireText("uuid");
        this.title = f.requireText("title");
        this.expirationDate = f.requireTimestamp("expirationDate");
        this.value = f.requireDecimal("value");
        this.paymentMethod = f.requireEnum("paymentMethod", PaymentMethod.class);
        this.status = f.requireEnum("status", ChargeStatus.class);
        this.customer = Customer.decode(f.requireObject("customer"));
        this.paidDate = f.optionalTimestamp("paidDate");
        this.authorizationCode = f.optionalText("authorizationCode");
        this.authorizationNsu = f.optionalText("authorizationNsu");
        this.installments = f.optionalInt("installments");
        this.installmentAmount = f.optionalDecimal("installmentAmount");
        this.kind = ChargeKind.of(paymentMethod);
        this.pix = kind == ChargeKind.PIX ? PixDetails.decode(f) : null;
        this.client = client;
    }

    private Charge(Charge source, BarteClient client) {
        this.uuid = source.uuid;
        this.title = source.title;
        this.expirationDate = source.expirationDate;
        this.value = source.value;
        this.paymentMethod = source.paymentMethod;
        this.status = source.status;
        this.customer = source.customer;
        this.paidDate = source.paidDate;
        this.authorizationCode = source.authorizationCode;
        this.authorizationNsu = source.authorizationNsu;
        this.installments = source.installments;
        this.installmentAmount = source.installmentAmount;
        this.kind = source.kind;
        this.pix = source.pix;
        this.client = client;
    }

    /** Decodes a charge that is not bound to any client. */
    public static Charge decode(JsonNode node) throws DecodingException {
        return decode(JsonFields.of(node), null);
    }

    /** Decodes a charge bound to {@code client}, which may be {@code null}. */
    public static Charge decode(JsonFields fields, BarteClient client) throws DecodingException {
        return new Charge(fields, client);
    }

    public boolean isPix() {
        return kind == ChargeKind.PIX;
    }

    /** @throws IllegalStateException if this is not a PIX charge */
    public PixDetails pix() {
        if (pix == null) {
            throw new IllegalStateException("Charge " + uuid + " is a " + paymentMethod + " charge, not PIX");
        }
        return pix;
    }

    /** Returns a copy of this charge bound to {@code client}. */
    public Charge withClient(BarteClient client) {
        return new Charge(this, client);
    }

    public boolean isBound() {
        return client != null;
    }

    @Override
    public Refund refund() throws IOException, InterruptedException {
        return refund(false);
    }

    @Override
    public Refund refund(boolean asFraud) throws IOException, InterruptedException {
        return client().refundCharge(uuid, asFraud);
    }

    @Override
    public void cancel() throws IOException, InterruptedException {
        client().cancelCharge(uuid);
    }

    /** Fetches the current QR-code data of this PIX charge. */
    public PixDetails pixQrCode() throws IOException, InterruptedException {
        return client().getPixQrCode(uuid);
    }

    private BarteClient client() {
        if (client == null) {
            throw new UninitializedClientException("Charge " + uuid);
        }
        return client;
    }

    @Override
    public String toString() {
        return "Charge{uuid=" + uuid + ", paymentMethod=" + paymentMethod + ", status=" + status + ", value=" + value + "}";
    }
}
