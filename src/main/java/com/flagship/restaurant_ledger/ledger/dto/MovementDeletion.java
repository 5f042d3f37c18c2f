package com.flagship.restaurant_ledger.ledger.dto;

import lombok.Value;

/**
 * Outcome of deleting a movement. When the movement was a purchase
 * expense, the whole invoice was deleted with it.
 */
@Value
public class MovementDeletion {
    Long movementId;
    Long deletedInvoiceId;
}
