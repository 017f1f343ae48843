package com.ordermetrics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Current state of one logistics order, as produced by the ingestion source.
 * Timestamps are timezone-naive. The numeric TAT fields are precomputed upstream
 * and carried through unchanged. {@code noKey} is the additive unit weight of the
 * record (normally 1) used by every count-style metric.
 */
public record OrderRecord(
    @JsonProperty("buyer_np") String buyerNp,
    @JsonProperty("seller_np") String sellerNp,
    @JsonProperty("network_order_id") String networkOrderId,
    @JsonProperty("provider_id") String providerId,
    @JsonProperty("network_transaction_id") String networkTransactionId,
    @JsonProperty("seller_name") String sellerName,
    @JsonProperty("seller_pincode") String sellerPincode,
    @JsonProperty("delivery_pincode") String deliveryPincode,
    @JsonProperty("domain") String domain,
    @JsonProperty("category") String category,
    @JsonProperty("consolidated_category") String consolidatedCategory,
    @JsonProperty("order_status") String orderStatus,
    @JsonProperty("cancellation_code") String cancellationCode,
    @JsonProperty("date") LocalDate date,
    @JsonProperty("created_at") LocalDateTime createdAt,
    @JsonProperty("ready_to_ship_at") LocalDateTime readyToShipAt,
    @JsonProperty("shipped_at") LocalDateTime shippedAt,
    @JsonProperty("promised_time") LocalDateTime promisedTime,
    @JsonProperty("updated_at") LocalDateTime updatedAt,
    @JsonProperty("tat_dif") Double tatDif,
    @JsonProperty("tat_diff_days") Double tatDiffDays,
    @JsonProperty("day_diff") Double dayDiff,
    @JsonProperty("min_diff") Double minDiff,
    @JsonProperty("tat_time") Double tatTime,
    @JsonProperty("on_time_delivery") Double onTimeDelivery,
    @JsonProperty("no_key") Integer noKey
) {

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of this record, for applying a lifecycle change.
     */
    public Builder toBuilder() {
        return new Builder()
            .buyerNp(buyerNp).sellerNp(sellerNp).networkOrderId(networkOrderId)
            .providerId(providerId).networkTransactionId(networkTransactionId)
            .sellerName(sellerName).sellerPincode(sellerPincode).deliveryPincode(deliveryPincode)
            .domain(domain).category(category).consolidatedCategory(consolidatedCategory)
            .orderStatus(orderStatus).cancellationCode(cancellationCode).date(date)
            .createdAt(createdAt).readyToShipAt(readyToShipAt).shippedAt(shippedAt)
            .promisedTime(promisedTime).updatedAt(updatedAt)
            .tatDif(tatDif).tatDiffDays(tatDiffDays).dayDiff(dayDiff).minDiff(minDiff)
            .tatTime(tatTime).onTimeDelivery(onTimeDelivery).noKey(noKey);
    }

    public static final class Builder {
        private String buyerNp;
        private String sellerNp;
        private String networkOrderId;
        private String providerId;
        private String networkTransactionId;
        private String sellerName;
        private String sellerPincode;
        private String deliveryPincode;
        private String domain;
        private String category;
        private String consolidatedCategory;
        private String orderStatus;
        private String cancellationCode;
        private LocalDate date;
        private LocalDateTime createdAt;
        private LocalDateTime readyToShipAt;
        private LocalDateTime shippedAt;
        private LocalDateTime promisedTime;
        private LocalDateTime updatedAt;
        private Double tatDif;
        private Double tatDiffDays;
        private Double dayDiff;
        private Double minDiff;
        private Double tatTime;
        private Double onTimeDelivery;
        private Integer noKey = 1;

        private Builder() {
        }

        public Builder buyerNp(String buyerNp) {
            this.buyerNp = buyerNp;
            return this;
        }

        public Builder sellerNp(String sellerNp) {
            this.sellerNp = sellerNp;
            return this;
        }

        public Builder networkOrderId(String networkOrderId) {
            this.networkOrderId = networkOrderId;
            return this;
        }

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder networkTransactionId(String networkTransactionId) {
            this.networkTransactionId = networkTransactionId;
            return this;
        }

        public Builder sellerName(String sellerName) {
            this.sellerName = sellerName;
            return this;
        }

        public Builder sellerPincode(String sellerPincode) {
            this.sellerPincode = sellerPincode;
            return this;
        }

        public Builder deliveryPincode(String deliveryPincode) {
            this.deliveryPincode = deliveryPincode;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder consolidatedCategory(String consolidatedCategory) {
            this.consolidatedCategory = consolidatedCategory;
            return this;
        }

        public Builder orderStatus(String orderStatus) {
            this.orderStatus = orderStatus;
            return this;
        }

        public Builder orderStatus(OrderStatus orderStatus) {
            this.orderStatus = orderStatus == null ? null : orderStatus.label();
            return this;
        }

        public Builder cancellationCode(String cancellationCode) {
            this.cancellationCode = cancellationCode;
            return this;
        }

        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder createdAt(LocalDateTime createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder readyToShipAt(LocalDateTime readyToShipAt) {
            this.readyToShipAt = readyToShipAt;
            return this;
        }

        public Builder shippedAt(LocalDateTime shippedAt) {
            this.shippedAt = shippedAt;
            return this;
        }

        public Builder promisedTime(LocalDateTime promisedTime) {
            this.promisedTime = promisedTime;
            return this;
        }

        public Builder updatedAt(LocalDateTime updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder tatDif(Double tatDif) {
            this.tatDif = tatDif;
            return this;
        }

        public Builder tatDiffDays(Double tatDiffDays) {
            this.tatDiffDays = tatDiffDays;
            return this;
        }

        public Builder dayDiff(Double dayDiff) {
            this.dayDiff = dayDiff;
            return this;
        }

        public Builder minDiff(Double minDiff) {
            this.minDiff = minDiff;
            return this;
        }

        public Builder tatTime(Double tatTime) {
            this.tatTime = tatTime;
            return this;
        }

        public Builder onTimeDelivery(Double onTimeDelivery) {
            this.onTimeDelivery = onTimeDelivery;
            return this;
        }

        public Builder noKey(Integer noKey) {
            this.noKey = noKey;
            return this;
        }

        public OrderRecord build() {
            return new OrderRecord(
                buyerNp, sellerNp, networkOrderId, providerId, networkTransactionId,
                sellerName, sellerPincode, deliveryPincode, domain, category, consolidatedCategory,
                orderStatus, cancellationCode, date, createdAt, readyToShipAt, shippedAt,
                promisedTime, updatedAt, tatDif, tatDiffDays, dayDiff, minDiff, tatTime,
                onTimeDelivery, noKey
            );
        }
    }
}
