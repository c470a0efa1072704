package com.barte.sdk.model;

import com.barte.sdk.Fixtures;
import com.barte.sdk.decode.DecodingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ChargeDecodingTest {

    @Test
    void decodesPixCharge() throws Exception {
        Charge charge = Charge.decode(Fixtures.tree("charge-pix.json"));

        assertEquals("c1", charge.uuid);
        assertEquals(0, new BigDecimal("1000.0").compareTo(charge.value));
        assertEquals(PaymentMethod.PIX, charge.paymentMethod);
        assertEquals(ChargeStatus.SCHEDULED, charge.status);
        assertEquals(ChargeKind.PIX, charge.kind);
        assertTrue(charge.isPix());
        assertEquals("John Doe", charge.customer.name);
        assertEquals(OffsetDateTime.of(2025, 2, 12, 0, 0, 0, 0, ZoneOffset.UTC), charge.expirationDate);
        assertTrue(charge.pix().pixCode.startsWith("000201"));
        assertEquals("https://sandbox-api.barte.com.br/v2/qrcodes/c1.png", charge.pix().pixQRCodeImage);
    }

    @Test
    void optionalFieldsKeepTheirState() throws Exception {
        Charge pix = Charge.decode(Fixtures.tree("charge-pix.json"));

        // sent as null
        assertTrue(pix.paidDate.isNull());
        assertTrue(pix.authorizationCode.isNull());
        // not sent at all
        assertTrue(pix.installments.isAbsent());
        assertTrue(pix.installmentAmount.isAbsent());
    }

    @Test
    void decodesPaidCardCharge() throws Exception {
        Charge charge = Charge.decode(Fixtures.tree("charge-card.json"));

        assertEquals(ChargeKind.STANDARD, charge.kind);
        assertFalse(charge.isPix());
        assertEquals(ChargeStatus.PAID, charge.status);
        assertEquals(new BigDecimal("59.9"), charge.value);
        assertEquals(OffsetDateTime.of(2025, 2, 12, 14, 30, 0, 0, ZoneOffset.ofHours(-3)), charge.paidDate.get());
        assertEquals("A1B2C3", charge.authorizationCode.get());
        assertEquals("000123", charge.authorizationNsu.get());
        assertEquals(3, charge.installments.get());
        assertEquals(new BigDecimal("19.97"), charge.installmentAmount.get());
        assertEquals("john.doe@example.org", charge.customer.alternativeEmail.get());
        assertThrows(IllegalStateException.class, charge::pix);
    }

    @Test
    void missingCustomerFails() {
        ObjectNode json = Fixtures.object("charge-pix.json");
        json.remove("customer");

        DecodingException ex = assertThrows(DecodingException.class, () -> Charge.decode(json));
        assertEquals("customer", ex.getPath());
    }

    @Test
    void customerWithoutNameFails() {
        ObjectNode json = Fixtures.object("charge-pix.json");
        ((ObjectNode) json.get("customer")).remove("name");

        DecodingException ex = assertThrows(DecodingException.class, () -> Charge.decode(json));
        assertEquals("customer.name", ex.getPath());
    }

    @Test
    void valueSentAsStringFails() {
        ObjectNode json = Fixtures.object("charge-card.json");
        json.put("value", "59.90");

        DecodingException ex = assertThrows(DecodingException.class, () -> Charge.decode(json));
        assertEquals("value", ex.getPath());
    }

    @Test
    void malformedPaidDateFails() {
        ObjectNode json = Fixtures.object("charge-card.json");
        json.put("paidDate", "12/02/2025 14:30");

        DecodingException ex = assertThrows(DecodingException.class, () -> Charge.decode(json));
        assertEquals("paidDate", ex.getPath());
    }

    @Test
    void unknownPaymentMethodFails() {
        ObjectNode json = Fixtures.object("charge-card.json");
        json.put("paymentMethod", "CASH");

        DecodingException ex = assertThrows(DecodingException.class, () -> Charge.decode(json));
        assertEquals("paymentMethod", ex.getPath());
    }

    @Test
    void pixChargeWithoutQrCodeFails() {
        ObjectNode json = Fixtures.object("charge-pix.json");
        json.remove("pixCode");

        DecodingException ex = assertThrows(DecodingException.class, () -> Charge.decode(json));
        assertEquals("pixCode", ex.getPath());
    }

    @Test
    void unknownPropertiesAreIgnored() throws Exception {
        ObjectNode json = Fixtures.object("charge-card.json");
        json.put("newServerField", true);

        assertEquals("c2", Charge.decode(json).uuid);
    }

    @Test
    void decodingIsRepeatable() throws Exception {
        Charge first = Charge.decode(Fixtures.tree("charge-card.json"));
        Charge second = Charge.decode(Fixtures.tree("charge-card.json"));

        assertEquals(first.uuid, second.uuid);
        assertEquals(first.value, second.value);
        assertEquals(first.paidDate, second.paidDate);
        assertEquals(first.installments, second.installments);
    }

    @Test
    void refundKeepsRefreshedCharge() throws Exception {
        Refund refund = Refund.decode(Fixtures.tree("refund.json"));

        assertEquals("c2", refund.chargeUuid);
        assertEquals(ChargeStatus.REFUND, refund.status);
        assertEquals(new BigDecimal("59.9"), refund.value);
        assertEquals(OffsetDateTime.of(2025, 2, 13, 9, 0, 0, 0, ZoneOffset.UTC), refund.createdAt.get());
        assertSame(refund.status, refund.charge.status);
    }

    @Test
    void refundFallsBackToCreatedAtWhenRefundDateIsNull() throws Exception {
        ObjectNode json = Fixtures.object("refund.json");
        json.putNull("refundDate");
        json.put("createdAt", "2025-02-10T08:00:00Z");

        Refund refund = Refund.decode(json);

        assertEquals(OffsetDateTime.of(2025, 2, 10, 8, 0, 0, 0, ZoneOffset.UTC), refund.createdAt.get());
    }

    @Test
    void refundWithoutAnyTimestampHasNoCreatedAt() throws Exception {
        ObjectNode json = Fixtures.object("refund.json");
        json.remove("refundDate");

        assertTrue(Refund.decode(json).createdAt.isAbsent());
    }
}
