package com.ryuqq.chronicle.testkit.fixture;

import com.ryuqq.chronicle.core.event.Validator;

import java.util.Objects;

/**
 * Test event: an order was placed.
 *
 * <p>Rejects a blank order id in {@link #validate()}.</p>
 */
public class OrderPlaced implements Validator {

    public static final String TYPE = "order-placed";

    private String orderId;
    private int quantity;

    public OrderPlaced() {
    }

    public OrderPlaced(String orderId, int quantity) {
        this.orderId = orderId;
        this.quantity = quantity;
    }

    @Override
    public void validate() {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("orderId cannot be blank");
        }
    }

    public String getOrderId() {
        return orderId;
    }

    public void setOrderId(String orderId) {
        this.orderId = orderId;
    }

    public int getQuantity() {
        return quantity;
    }

    public void setQuantity(int quantity) {
        this.quantity = quantity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OrderPlaced other)) {
            return false;
        }
        return quantity == other.quantity && Objects.equals(orderId, other.orderId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId, quantity);
    }

    @Override
    public String toString() {
        return "OrderPlaced{orderId='" + orderId + "', quantity=" + quantity + '}';
    }
}
