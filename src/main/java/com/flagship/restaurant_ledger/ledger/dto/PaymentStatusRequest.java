package com.flagship.restaurant_ledger.ledger.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class PaymentStatusRequest {
    String paymentStatus;
    String movementDate;
}
