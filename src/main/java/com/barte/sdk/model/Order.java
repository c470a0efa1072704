package com.barte.sdk.model;

import com.barte.sdk.client.BarteClient;
import com.barte.sdk.decode.DecodingException;
import com.barte.sdk.decode.Field;
import com.barte.sdk.decode.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A billing intent returned by {@code POST /orders}. One order may fan out to
 * several charge attempts, kept in server order in {@link #charges}.
 */
public final class Order implements Refundable<List<Refund>>, Cancelable {

    private static final Logger LOG = LoggerFactory.getLogger(Order.class);

    public final String uuid;
    public final String status;
    public final String title;
    public final Field<String> description;
    public final BigDecimal value;
    public final int installments;
    public final OffsetDateTime startDate;
    public final PaymentMethod payment;
    public final Customer customer;
    public final String idempotencyKey;
    public final List<Charge> charges;

    private final BarteClient client;

    private Order(JsonFields f, BarteClient client) throws DecodingException {
        this.uuid = f.requireText("uuid");
        this.status = f.requireText("status");
        this.title = f.requireText("title");
        this.description = f.optionalText("description");
        this.value = f.requireDecimal("value");
        this.installments = f.requireInt("installments");
        this.startDate = f.requireTimestamp("startDate");
        this.payment = f.requireEnum("payment", PaymentMethod.class);
        this.customer = Customer.decode(f.requireObject("customer"));
        this.idempotencyKey = f.requireText("idempotencyKey");
        this.charges = f.requireList("charges", charge -> Charge.decode(charge, client));
        this.client = client;
    }

    private Order(Order source, BarteClient client) {
        this.uuid = source.uuid;
        this.status = source.status;
        this.title = source.title;
        this.description = source.description;
        this.value = source.value;
        this.installments = source.installments;
        this.startDate = source.startDate;
        this.payment = source.payment;
        this.customer = source.customer;
        this.idempotencyKey = source.idempotencyKey;
        List<Charge> rebound = new ArrayList<>(source.charges.size());
        for (Charge charge : source.charges) {
            rebound.add(charge.withClient(client));
        }
        this.charges = Collections.unmodifiableList(rebound);
        this.client = client;
    }

    /** Decodes an order that is not bound to any client. */
    public static Order decode(JsonNode node) throws DecodingException {
        return decode(node, null);
    }

    /** Decodes an order, and its charges, bound to {@code client}, which may be {@code null}. */
    public static Order decode(JsonNode node, BarteClient client) throws DecodingException {
        return new Order(JsonFields.of(node), client);
    }

    /** Returns a copy of this order, charges included, bound to {@code client}. */
    public Order withClient(BarteClient client) {
        return new Order(this, client);
    }

    /**
     * Refunds every charge of this order, in order.
     *
     * @throws OrderChargesException if some charges could not be refunded; it carries the refunds that succeeded
     */
    @Override
    public List<Refund> refund() throws IOException, InterruptedException {
        return refund(false);
    }

    @Override
    public List<Refund> refund(boolean asFraud) throws IOException, InterruptedException {
        BarteClient bound = client();
        List<Refund> refunds = new ArrayList<>(charges.size());
        List<String> completed = new ArrayList<>(charges.size());
        Map<String, IOException> failures = new LinkedHashMap<>();
        for (Charge charge : charges) {
            try {
                refunds.add(bound.refundCharge(charge.uuid, asFraud));
                completed.add(charge.uuid);
            } catch (IOException e) {
                LOG.warn("Refund of charge {} of order {} failed: {}", charge.uuid, uuid, e.getMessage());
                failures.put(charge.uuid, e);
            }
        }
        if (!failures.isEmpty()) {
            throw new OrderChargesException(uuid, completed, refunds, failures);
        }
        return refunds;
    }

    /**
     * Cancels every charge of this order; the server decides which cancellations are valid.
     *
     * @throws OrderChargesException if some charges could not be canceled
     */
    @Override
    public void cancel() throws IOException, InterruptedException {
        BarteClient bound = client();
        List<String> completed = new ArrayList<>(charges.size());
        Map<String, IOException> failures = new LinkedHashMap<>();
        for (Charge charge : charges) {
            try {
                bound.cancelCharge(charge.uuid);
                completed.add(charge.uuid);
            } catch (IOException e) {
                LOG.warn("Cancel of charge {} of order {} failed: {}", charge.uuid, uuid, e.getMessage());
                failures.put(charge.uuid, e);
            }
        }
        if (!failures.isEmpty()) {
            throw new OrderChargesException(uuid, completed, List.of(), failures);
        }
    }

    private BarteClient client() {
        if (client == null) {
            throw new UninitializedClientException("Order " + uuid);
        }
        return client;
    }
}
