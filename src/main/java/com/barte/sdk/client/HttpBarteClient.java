package com.barte.sdk.client;

import com.barte.sdk.decode.DecodingException;
import com.barte.sdk.decode.JsonFields;
import com.barte.sdk.model.Buyer;
import com.barte.sdk.model.CardToken;
import com.barte.sdk.model.Charge;
import com.barte.sdk.model.InstallmentOptions;
import com.barte.sdk.model.Order;
import com.barte.sdk.model.Page;
import com.barte.sdk.model.PixDetails;
import com.barte.sdk.model.Refund;
import com.barte.sdk.request.BuyerFilter;
import com.barte.sdk.request.BuyerRequest;
import com.barte.sdk.request.CardTokenRequest;
import com.barte.sdk.request.ChargeFilter;
import com.barte.sdk.request.OrderRequest;
import com.barte.sdk.request.RefundRequest;
import com.barte.sdk.transport.HttpMethod;
import com.barte.sdk.transport.HttpTransport;
import com.barte.sdk.transport.Transport;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link BarteClient} speaking the v2 API through a {@link Transport}.
 *
 * <p>Entities returned by this client are bound to it, so their convenience
 * methods ({@code charge.refund()}, {@code order.cancel()}) go through the same
 * client. Several clients can be used side by side; there is no shared state.
 */
public class HttpBarteClient implements BarteClient {

    private static final Logger LOG = LoggerFactory.getLogger(HttpBarteClient.class);

    static final String API_PREFIX = "/v2";

    private final Transport transport;

    public HttpBarteClient(ClientConfig config) {
        this(new HttpTransport(config));
    }

    public HttpBarteClient(Transport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public Order createOrder(OrderRequest request) throws IOException, InterruptedException {
        Objects.requireNonNull(request, "request");
        if (request.idempotencyKey == null || request.idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("idempotencyKey is required to create an order");
        }
        LOG.debug("Creating order '{}' with idempotency key {}", request.title, request.idempotencyKey);
        JsonNode json = transport.send(HttpMethod.POST, API_PREFIX + "/orders", null, request);
        return Order.decode(json, this);
    }

    @Override
    public Charge getCharge(String chargeUuid) throws IOException, InterruptedException {
        JsonNode json = transport.send(HttpMethod.GET, chargePath(chargeUuid), null, null);
        return Charge.decode(JsonFields.of(json), this);
    }

    @Override
    public Page<Charge> listCharges() throws IOException, InterruptedException {
        return listCharges(ChargeFilter.create());
    }

    @Override
    public Page<Charge> listCharges(ChargeFilter filter) throws IOException, InterruptedException {
        Map<String, String> query = filter == null ? Map.of() : filter.toQuery();
        JsonNode json = transport.send(HttpMethod.GET, API_PREFIX + "/charges", query, null);
        return Page.decode(json, charge -> Charge.decode(charge, this));
    }

    @Override
    public void cancelCharge(String chargeUuid) throws IOException, InterruptedException {
        transport.send(HttpMethod.DELETE, chargePath(chargeUuid), null, null);
        LOG.debug("Canceled charge {}", chargeUuid);
    }

    @Override
    public Refund refundCharge(String chargeUuid) throws IOException, InterruptedException {
        return refundCharge(chargeUuid, false);
    }

    @Override
    public Refund refundCharge(String chargeUuid, boolean asFraud) throws IOException, InterruptedException {
        JsonNode json = transport.send(HttpMethod.PATCH, chargePath(chargeUuid) + "/refund", null,
                new RefundRequest(asFraud));
        return Refund.decode(json, this);
    }

    @Override
    public List<Refund> getChargeRefunds(String chargeUuid) throws IOException, InterruptedException {
        JsonNode json = transport.send(HttpMethod.GET, chargePath(chargeUuid) + "/refunds", null, null);
        return JsonFields.list(json, refund -> Refund.decode(refund, this));
    }

    @Override
    public Buyer createBuyer(BuyerRequest request) throws IOException, InterruptedException {
        Objects.requireNonNull(request, "request");
        return Buyer.decode(transport.send(HttpMethod.POST, API_PREFIX + "/buyers", null, request));
    }

    @Override
    public Page<Buyer> getBuyers() throws IOException, InterruptedException {
        return getBuyers(BuyerFilter.create());
    }

    @Override
    public Page<Buyer> getBuyers(BuyerFilter filter) throws IOException, InterruptedException {
        Map<String, String> query = filter == null ? Map.of() : filter.toQuery();
        JsonNode json = transport.send(HttpMethod.GET, API_PREFIX + "/buyers", query, null);
        return Page.decode(json, Buyer::decode);
    }

    @Override
    public CardToken createCardToken(CardTokenRequest request) throws IOException, InterruptedException {
        Objects.requireNonNull(request, "request");
        return CardToken.decode(transport.send(HttpMethod.POST, API_PREFIX + "/cards", null, request));
    }

    @Override
    public PixDetails getPixQrCode(String chargeUuid) throws IOException, InterruptedException {
        Charge charge = getCharge(chargeUuid);
        if (!charge.isPix()) {
            throw new DecodingException("paymentMethod", "expected a PIX charge but was " + charge.paymentMethod);
        }
        return charge.pix();
    }

    @Override
    public InstallmentOptions simulateInstallments(BigDecimal amount, String brand)
            throws IOException, InterruptedException {
        Objects.requireNonNull(amount, "amount");
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("amount", amount.toPlainString());
        query.put("brand", brand);
        return installments(query);
    }

    @Override
    public InstallmentOptions getInstallments(BigDecimal amount, int maxInstallments)
            throws IOException, InterruptedException {
        Objects.requireNonNull(amount, "amount");
        if (maxInstallments < 1) {
            throw new IllegalArgumentException("maxInstallments must be positive but was " + maxInstallments);
        }
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("amount", amount.toPlainString());
        query.put("maxInstallments", maxInstallments);
        return installments(query);
    }

    private InstallmentOptions installments(Map<String, Object> query) throws IOException, InterruptedException {
        JsonNode json = transport.send(HttpMethod.GET, API_PREFIX + "/orders/installments-payment", query, null);
        return InstallmentOptions.decode(json);
    }

    private static String chargePath(String chargeUuid) {
        if (chargeUuid == null || chargeUuid.isBlank()) {
            throw new IllegalArgumentException("charge uuid must not be blank");
        }
        return API_PREFIX + "/charges/" + URLEncoder.encode(chargeUuid, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
