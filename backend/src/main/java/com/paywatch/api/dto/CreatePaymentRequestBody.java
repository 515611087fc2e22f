package com.paywatch.api.dto;

import com.paywatch.api.validation.SupportedChain;
import com.paywatch.lifecycle.CreatePaymentRequestCommand;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * POST /api/v1/requests request body. Validated with Jakarta Bean Validation.
 */
public record CreatePaymentRequestBody(
        @NotBlank(message = "INVALID_AMOUNT")
        @Pattern(regexp = "^\\s*\\d+(\\.\\d+)?\\s*$", message = "INVALID_AMOUNT")
        String amount,

        @NotBlank(message = "INVALID_CURRENCY")
        String currency,

        @NotBlank(message = "INVALID_CHAIN")
        @SupportedChain
        String chain,

        @NotBlank(message = "INVALID_RECIPIENT")
        String recipient,

        @Size(max = 500, message = "INVALID_DESCRIPTION")
        String description
) {

    public CreatePaymentRequestCommand toCommand() {
        return new CreatePaymentRequestCommand(amount, currency, chain, recipient, description);
    }
}
