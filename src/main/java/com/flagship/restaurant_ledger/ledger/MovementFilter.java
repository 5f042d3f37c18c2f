package com.flagship.restaurant_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.StringJoiner;

/**
 * Optional criteria for listing movements. {@code endDate} is inclusive of the whole day.
 */
@Value
@Builder
public class MovementFilter {
    LocalDate startDate;
    LocalDate endDate;
    MovementType type;
    String category;
    PaymentStatus paymentStatus;
    String relatedEntityType;
    Long relatedEntityId;
    String paymentGatewayId;
    String transactionId;
    String bankAccount;
    Boolean reconciled;

    public static MovementFilter none() {
        return MovementFilter.builder().build();
    }

    /**
     * Stable textual form used to derive cache keys.
     */
    public String normalized() {
        StringJoiner joiner = new StringJoiner("|");
        joiner.add("start=" + startDate)
                .add("end=" + endDate)
                .add("type=" + type)
                .add("category=" + category)
                .add("status=" + paymentStatus)
                .add("relatedType=" + relatedEntityType)
                .add("relatedId=" + relatedEntityId)
                .add("gateway=" + paymentGatewayId)
                .add("transaction=" + transactionId)
                .add("bank=" + bankAccount)
                .add("reconciled=" + reconciled);
        return joiner.toString();
    }
}
