package com.ryuqq.chronicle.testkit.fixture;

import java.util.Objects;

/**
 * Test event: an order was shipped.
 */
public class OrderShipped {

    public static final String TYPE = "order-shipped";

    private String orderId;
    private String carrier;

    public OrderShipped() {
    }

    public OrderShipped(String orderId, String carrier) {
        this.orderId = orderId;
        this.carrier = carrier;
    }

    public String getOrderId() {
        return orderId;
    }

    public void setOrderId(String orderId) {
        this.orderId = orderId;
    }

    public String getCarrier() {
        return carrier;
    }

    public void setCarrier(String carrier) {
        this.carrier = carrier;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OrderShipped other)) {
            return false;
        }
        return Objects.equals(orderId, other.orderId) && Objects.equals(carrier, other.carrier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId, carrier);
    }

    @Override
    public String toString() {
        return "OrderShipped{orderId='" + orderId + "', carrier='" + carrier + "'}";
    }
}
