package com.soora.shop.exception;

/**
 * Exception thrown when an order asks for more units than a product has in stock.
 *
 * @author Soora Platform Team
 */
public class OutOfStockException extends RuntimeException {

    private final String productId;
    private final Integer requestedQuantity;
    private final Integer availableQuantity;

    public OutOfStockException(String productId, Integer requestedQuantity, Integer availableQuantity) {
        super(String.format("Product %s is out of stock. Requested: %d, Available: %d",
                productId, requestedQuantity, availableQuantity));
        this.productId = productId;
        this.requestedQuantity = requestedQuantity;
        this.availableQuantity = availableQuantity;
    }

    public String getProductId() {
        return productId;
    }

    public Integer getRequestedQuantity() {
        return requestedQuantity;
    }

    public Integer getAvailableQuantity() {
        return availableQuantity;
    }
}
