package com.soora.shop.api.dto;

import java.time.Instant;

/**
 * Liveness probe body.
 *
 * @author Soora Platform Team
 */
public class HealthResponse {

    private String status;
    private String message;
    private Instant timestamp;
    private String region;

    public HealthResponse() {
    }

    public HealthResponse(String status, String message, Instant timestamp, String region) {
        this.status = status;
        this.message = message;
        this.timestamp = timestamp;
        this.region = region;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }
}
