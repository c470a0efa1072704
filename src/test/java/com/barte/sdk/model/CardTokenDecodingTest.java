package com.barte.sdk.model;

import com.barte.sdk.Fixtures;
import com.barte.sdk.decode.DecodingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class CardTokenDecodingTest {

    @Test
    void decodesCardToken() throws Exception {
        CardToken token = CardToken.decode(Fixtures.tree("card-token.json"));

        assertEquals("tok_123456", token.uuid);
        assertEquals("visa", token.brand);
        assertEquals("John Doe", token.cardHolderName);
        assertTrue(token.cvvChecked);
        assertEquals("411111", token.first6digits);
        assertEquals("1111", token.last4digits);
        assertEquals("12", token.expirationMonth);
        assertEquals("2030", token.expirationYear);
        assertEquals(OffsetDateTime.of(2025, 1, 7, 10, 0, 0, 0, ZoneOffset.UTC), token.createdAt);
    }

    @Test
    void cvvCheckedMustBeBoolean() {
        ObjectNode json = Fixtures.object("card-token.json");
        json.put("cvvChecked", "true");

        DecodingException ex = assertThrows(DecodingException.class, () -> CardToken.decode(json));
        assertEquals("cvvChecked", ex.getPath());
    }

    @Test
    void decodesInstallmentOptions() throws Exception {
        InstallmentOptions options = InstallmentOptions.decode(Fixtures.tree("installments.json"));

        assertEquals(3, options.installments.size());
        assertEquals(new BigDecimal("1000"), options.installments.get(0).amount);
        assertEquals(0, new BigDecimal("2.0").compareTo(options.installments.get(1).interestRate));
        assertEquals(3, options.installments.get(2).installments);
        assertEquals(new BigDecimal("1035"), options.installments.get(2).total);
    }
}
