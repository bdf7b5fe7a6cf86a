package com.flagship.stream_ledger.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Payment is optional. Leaving it out joins without paying.
 */
@Value
public class JoinStreamRequest {

    @JsonProperty("payment")
    Long payment;
}
