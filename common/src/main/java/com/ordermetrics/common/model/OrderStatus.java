package com.ordermetrics.common.model;

/**
 * Order status labels as written by the ingestion source.
 * Exactly one status holds for an order at any time.
 */
public enum OrderStatus {
    CREATED("Created"),
    IN_PROCESS("In Process"),
    DELIVERED("Delivered"),
    CANCELLED("Cancelled"),
    PART_DELIVERED("Part Delivered");

    private final String label;

    OrderStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Exact, case-sensitive match against a raw status label. A null label matches nothing.
     */
    public boolean matches(String rawLabel) {
        return label.equals(rawLabel);
    }

    /**
     * Resolve a raw label, or null when the label is missing or unknown.
     */
    public static OrderStatus fromLabel(String rawLabel) {
        for (OrderStatus status : values()) {
            if (status.matches(rawLabel)) {
                return status;
            }
        }
        return null;
    }
}
