package com.barte.sdk.model;

import com.barte.sdk.Fixtures;
import com.barte.sdk.decode.DecodingException;
import com.barte.sdk.request.CustomerPayload;
import com.barte.sdk.request.OrderPayment;
import com.barte.sdk.request.OrderRequest;
import com.barte.sdk.util.Json;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class OrderDecodingTest {

    @Test
    void decodesOrderWithCharges() throws Exception {
        Order order = Order.decode(Fixtures.tree("order.json"));

        assertEquals("o1", order.uuid);
        assertEquals("ACTIVE", order.status);
        assertEquals("Loja virtual", order.description.get());
        assertEquals(2, order.installments);
        assertEquals(PaymentMethod.CREDIT_CARD, order.payment);
        assertEquals("BR", order.customer.documentCountry.get());
        assertEquals("order-123-attempt-1", order.idempotencyKey);
        assertEquals(2, order.charges.size());
        assertEquals("c10", order.charges.get(0).uuid);
        assertEquals(ChargeStatus.PAID, order.charges.get(0).status);
        assertEquals("c11", order.charges.get(1).uuid);
        assertTrue(order.charges.get(1).paidDate.isAbsent());
    }

    @Test
    void brokenChargeFailsTheWholeOrder() {
        ObjectNode json = Fixtures.object("order.json");
        ((ObjectNode) json.get("charges").get(1)).remove("status");

        DecodingException ex = assertThrows(DecodingException.class, () -> Order.decode(json));
        assertEquals("charges[1].status", ex.getPath());
    }

    @Test
    void chargesListIsUnmodifiable() throws Exception {
        Order order = Order.decode(Fixtures.tree("order.json"));

        assertThrows(UnsupportedOperationException.class, () -> order.charges.clear());
    }

    @Test
    void requestEchoDecodesToEquivalentValues() throws Exception {
        OrderRequest request = new OrderRequest(LocalDate.of(2025, 2, 7), new BigDecimal("250.50"), 3,
                "Pedido #456", OrderPayment.creditCard("tok_1"), "order-456");
        request.customer = new CustomerPayload("12345678900", "Maria Silva", "maria@example.com", "21988888888");

        // server echo: request fields plus server-assigned ones
        ObjectNode echo = Json.MAPPER.valueToTree(request);
        echo.put("uuid", "o2");
        echo.put("status", "ACTIVE");
        echo.put("payment", "CREDIT_CARD");
        ArrayNode charges = echo.putArray("charges");
        ObjectNode charge = charges.addObject();
        charge.put("uuid", "c20");
        charge.put("title", request.title);
        charge.put("expirationDate", "2025-02-07");
        charge.put("value", new BigDecimal("83.50"));
        charge.put("paymentMethod", "CREDIT_CARD");
        charge.put("status", "SCHEDULED");
        charge.set("customer", echo.get("customer"));

        Order order = Order.decode(echo);

        assertEquals(0, request.value.compareTo(order.value));
        assertEquals(request.customer.name, order.customer.name);
        assertEquals(request.installments.intValue(), order.installments);
        assertEquals(request.idempotencyKey, order.idempotencyKey);
        assertEquals(request.startDate, order.startDate.toLocalDate());
        assertTrue(order.description.isAbsent());
    }
}
