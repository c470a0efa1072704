package com.barte.sdk.client;

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

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;

/**
 * Contract for calling the Barte payments API.
 *
 * <p>Every operation is a single blocking round trip. Failures surface as
 * {@link com.barte.sdk.transport.RemoteApiException} when the server rejects the
 * call and as {@link com.barte.sdk.decode.DecodingException} when a successful
 * answer does not have the expected shape; nothing is retried.
 */
public interface BarteClient {

    /**
     * Creates an order.
     *
     * @param request order data; {@code idempotencyKey} must be set
     * @return the created order with its charges
     * @throws IllegalArgumentException if the idempotency key is missing
     * @throws IOException if HTTP request fails, returns non-2xx status or cannot be decoded
     * @throws InterruptedException if the request is interrupted
     */
    Order createOrder(OrderRequest request) throws IOException, InterruptedException;

    /**
     * Fetches one charge.
     *
     * @param chargeUuid charge identifier
     * @return the charge; a PIX charge carries its QR-code fields
     * @throws IOException if HTTP request fails, returns non-2xx status or cannot be decoded
     * @throws InterruptedException if the request is interrupted
     */
    Charge getCharge(String chargeUuid) throws IOException, InterruptedException;

    /** Returns the first unfiltered page of charges. */
    Page<Charge> listCharges() throws IOException, InterruptedException;

    Page<Charge> listCharges(ChargeFilter filter) throws IOException, InterruptedException;

    /**
     * Cancels a charge. Whether the charge can still be canceled is decided by the server.
     *
     * @throws IOException if HTTP request fails or returns non-2xx status
     * @throws InterruptedException if the request is interrupted
     */
    void cancelCharge(String chargeUuid) throws IOException, InterruptedException;

    /** Refunds a charge without flagging it as fraud. */
    Refund refundCharge(String chargeUuid) throws IOException, InterruptedException;

    Refund refundCharge(String chargeUuid, boolean asFraud) throws IOException, InterruptedException;

    /**
     * Lists the refunds recorded for a charge.
     *
     * @param chargeUuid charge identifier
     * @return refunds in the order the server returned them, possibly empty
     * @throws IOException if HTTP request fails, returns non-2xx status or the body is not an array of refunds
     * @throws InterruptedException if the request is interrupted
     */
    List<Refund> getChargeRefunds(String chargeUuid) throws IOException, InterruptedException;

    Buyer createBuyer(BuyerRequest request) throws IOException, InterruptedException;

    /** Returns the first unfiltered page of buyers. */
    Page<Buyer> getBuyers() throws IOException, InterruptedException;

    Page<Buyer> getBuyers(BuyerFilter filter) throws IOException, InterruptedException;

    CardToken createCardToken(CardTokenRequest request) throws IOException, InterruptedException;

    /**
     * Re-fetches a PIX charge and returns its QR-code data.
     *
     * @throws com.barte.sdk.decode.DecodingException if the charge is not a PIX charge
     * @throws IOException if HTTP request fails or returns non-2xx status
     * @throws InterruptedException if the request is interrupted
     */
    PixDetails getPixQrCode(String chargeUuid) throws IOException, InterruptedException;

    /** Simulates card installments for {@code amount} on a card {@code brand}. */
    InstallmentOptions simulateInstallments(BigDecimal amount, String brand) throws IOException, InterruptedException;

    /** Lists installment options for {@code amount} up to {@code maxInstallments}. */
    InstallmentOptions getInstallments(BigDecimal amount, int maxInstallments) throws IOException, InterruptedException;
}
