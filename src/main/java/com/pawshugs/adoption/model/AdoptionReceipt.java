package com.pawshugs.adoption.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AdoptionReceipt(
    String message,
    @JsonProperty("request_id") String requestId
) {
    public static AdoptionReceipt received(String requestId) {
        return new AdoptionReceipt("Request received", requestId);
    }
}
