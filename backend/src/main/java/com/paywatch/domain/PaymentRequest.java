package com.paywatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Duration;
import java.time.Instant;

/**
 * Merchant-issued, time-boxed invoice for a fixed amount of one asset on one chain.
 * {@code expiresAt} is always {@code createdAt + 1h} and is never recalculated.
 */
@Document(collection = "payment_requests")
@CompoundIndex(name = "status_expires", def = "{'status': 1, 'expiresAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PaymentRequest {

    public static final Duration TIME_TO_LIVE = Duration.ofHours(1);

    @Id
    @EqualsAndHashCode.Include
    private String id;
    /** Decimal string; exact units the payer must send. */
    private String amount;
    private String currency;
    private String chain;
    private String recipient;
    private String description;
    private PaymentRequestStatus status;
    private Instant createdAt;
    private Instant expiresAt;
    /** Advisory: most recent oracle poll. */
    private Instant lastChecked;
    private Instant updatedAt;

    /**
     * New PENDING request created at {@code now}.
     */
    public static PaymentRequest newPending(String id, String amount, String currency, String chain,
                                            String recipient, String description, Instant now) {
        PaymentRequest request = new PaymentRequest();
        request.setId(id);
        request.setAmount(amount);
        request.setCurrency(currency);
        request.setChain(chain);
        request.setRecipient(recipient);
        request.setDescription(description);
        request.setStatus(PaymentRequestStatus.PENDING);
        request.setCreatedAt(now);
        request.setExpiresAt(now.plus(TIME_TO_LIVE));
        request.setUpdatedAt(now);
        return request;
    }

    public boolean isPending() {
        return status == PaymentRequestStatus.PENDING;
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    /** Pending and still inside its validity window. */
    public boolean isActiveAt(Instant now) {
        return isPending() && !isExpiredAt(now);
    }

    public PaymentRequest copy() {
        PaymentRequest c = new PaymentRequest();
        c.setId(id);
        c.setAmount(amount);
        c.setCurrency(currency);
        c.setChain(chain);
        c.setRecipient(recipient);
        c.setDescription(description);
        c.setStatus(status);
        c.setCreatedAt(createdAt);
        c.setExpiresAt(expiresAt);
        c.setLastChecked(lastChecked);
        c.setUpdatedAt(updatedAt);
        return c;
    }
}
