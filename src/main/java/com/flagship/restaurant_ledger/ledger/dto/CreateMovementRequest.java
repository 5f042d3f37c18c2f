package com.flagship.restaurant_ledger.ledger.dto;

import com.flagship.restaurant_ledger.ledger.MovementDateParser;
import com.flagship.restaurant_ledger.ledger.MovementType;
import com.flagship.restaurant_ledger.ledger.NewMovement;
import com.flagship.restaurant_ledger.ledger.PaymentStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Request body for recording a movement. Dates accept DD-MM-YYYY or ISO forms.
 * Constraint messages name the {@link com.flagship.restaurant_ledger.common.exception.ErrorCode}
 * reported when they fail.
 */
@Value
@Builder
@Jacksonized
public class CreateMovementRequest {
    @NotBlank(message = "INVALID_TYPE")
    String type;

    @NotNull(message = "INVALID_VALUE")
    @Positive(message = "INVALID_VALUE")
    BigDecimal value;

    String category;
    String subcategory;

    @NotBlank(message = "INVALID_DESCRIPTION")
    String description;

    String movementDate;
    String paymentStatus;
    String paymentMethod;
    String senderReceiver;
    String relatedEntityType;
    Long relatedEntityId;
    String notes;
    String paymentGatewayId;
    String transactionId;
    String bankAccount;

    /**
     * @throws com.flagship.restaurant_ledger.common.exception.LedgerException
     *         INVALID_TYPE, INVALID_STATUS or INVALID_DATE
     */
    public NewMovement toNewMovement() {
        return NewMovement.builder()
                .type(MovementType.parse(type))
                .value(value)
                .category(category)
                .subcategory(subcategory)
                .description(description)
                .movementDate(MovementDateParser.parse(movementDate))
                .paymentStatus(PaymentStatus.parseOrPending(paymentStatus))
                .paymentMethod(paymentMethod)
                .senderReceiver(senderReceiver)
                .relatedEntityType(relatedEntityType)
                .relatedEntityId(relatedEntityId)
                .notes(notes)
                .paymentGatewayId(paymentGatewayId)
                .transactionId(transactionId)
                .bankAccount(bankAccount)
                .build();
    }
}
