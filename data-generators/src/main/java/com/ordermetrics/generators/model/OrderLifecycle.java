package com.ordermetrics.generators.model;

import com.ordermetrics.common.model.OrderStatus;

import java.time.LocalDateTime;

/**
 * Simulation state of one order as it moves from {@code In Process} to a terminal status.
 * Holds raw milestones only; the derived order-level fields are computed by
 * {@link com.ordermetrics.generators.OrderRecordFactory}.
 */
public class OrderLifecycle {

    private final String buyerNp;
    private final String sellerNp;
    private final String networkOrderId;
    private final String providerId;
    private final String networkTransactionId;
    private final String category;
    private final LocalDateTime createdAt;
    private final LocalDateTime promisedAt;

    private String sellerName;
    private String sellerPincode;
    private String deliveryPincode;
    private String domain;

    private OrderStatus status = OrderStatus.IN_PROCESS;
    private LocalDateTime readyToShipAt;
    private LocalDateTime shippedAt;
    private LocalDateTime completedAt;
    private LocalDateTime cancelledAt;
    private String rawCancellationCode;
    private boolean rto;

    public OrderLifecycle(String buyerNp, String sellerNp, String networkOrderId, String providerId,
                          String networkTransactionId, String category,
                          LocalDateTime createdAt, LocalDateTime promisedAt) {
        this.buyerNp = buyerNp;
        this.sellerNp = sellerNp;
        this.networkOrderId = networkOrderId;
        this.providerId = providerId;
        this.networkTransactionId = networkTransactionId;
        this.category = category;
        this.createdAt = createdAt;
        this.promisedAt = promisedAt;
    }

    public OrderLifecycle withSeller(String sellerName, String sellerPincode) {
        this.sellerName = sellerName;
        this.sellerPincode = sellerPincode;
        return this;
    }

    public OrderLifecycle withDelivery(String domain, String deliveryPincode) {
        this.domain = domain;
        this.deliveryPincode = deliveryPincode;
        return this;
    }

    public void readyToShip(LocalDateTime at) {
        this.readyToShipAt = at;
    }

    public void ship(LocalDateTime at) {
        this.shippedAt = at;
    }

    public void deliver(LocalDateTime at) {
        this.status = OrderStatus.DELIVERED;
        this.completedAt = at;
    }

    public void partDeliver(LocalDateTime at) {
        this.status = OrderStatus.PART_DELIVERED;
        this.completedAt = at;
    }

    /**
     * @param rawCode cancellation code as reported by the seller, possibly null
     * @param rto true when the order was returned to origin
     */
    public void cancel(LocalDateTime at, String rawCode, boolean rto) {
        this.status = OrderStatus.CANCELLED;
        this.cancelledAt = at;
        this.rawCancellationCode = rawCode;
        this.rto = rto;
    }

    public boolean isTerminal() {
        return status != OrderStatus.IN_PROCESS && status != OrderStatus.CREATED;
    }

    public String buyerNp() {
        return buyerNp;
    }

    public String sellerNp() {
        return sellerNp;
    }

    public String networkOrderId() {
        return networkOrderId;
    }

    public String providerId() {
        return providerId;
    }

    public String networkTransactionId() {
        return networkTransactionId;
    }

    public String category() {
        return category;
    }

    public LocalDateTime createdAt() {
        return createdAt;
    }

    public LocalDateTime promisedAt() {
        return promisedAt;
    }

    public String sellerName() {
        return sellerName;
    }

    public String sellerPincode() {
        return sellerPincode;
    }

    public String deliveryPincode() {
        return deliveryPincode;
    }

    public String domain() {
        return domain;
    }

    public OrderStatus status() {
        return status;
    }

    public LocalDateTime readyToShipAt() {
        return readyToShipAt;
    }

    public LocalDateTime shippedAt() {
        return shippedAt;
    }

    public LocalDateTime completedAt() {
        return completedAt;
    }

    public LocalDateTime cancelledAt() {
        return cancelledAt;
    }

    public String rawCancellationCode() {
        return rawCancellationCode;
    }

    public boolean isRto() {
        return rto;
    }
}
