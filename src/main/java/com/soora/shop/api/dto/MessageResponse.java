package com.soora.shop.api.dto;

/**
 * Plain acknowledgement body, e.g. {@code {"message": "Address deleted"}}.
 *
 * @author Soora Platform Team
 */
public class MessageResponse {

    private String message;

    public MessageResponse() {
    }

    public MessageResponse(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
