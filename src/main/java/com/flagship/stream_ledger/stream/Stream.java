package com.flagship.stream_ledger.stream;

import com.flagship.stream_ledger.balance.Balance;
import com.flagship.stream_ledger.exception.InsufficientPaymentException;
import com.flagship.stream_ledger.exception.InvalidStateException;
import com.flagship.stream_ledger.exception.NotAuthorizedException;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Stream domain object: one broadcast's lifecycle, metadata and revenue.
 *
 * Key principles:
 * - Status transitions are explicit and validated (CREATED → LIVE → ENDED → ARCHIVED)
 * - Creator-only operations check the caller against {@link #creator}
 * - The revenue balance only grows through deposits and only shrinks through distribution
 * - State changes are immutable (every transition returns a new Stream)
 *
 * Timestamps are epoch milliseconds supplied by the caller's time source.
 * startedAt and endedAt stay 0 until they are set, exactly once.
 */
@Value
@Builder(toBuilder = true)
public class Stream {

    public static final int INITIAL_MODERATION_SCORE = 100;
    public static final int MAX_BASIS_POINTS = 10_000;
    public static final int MAX_ADDRESS_LENGTH = 100;
    public static final int MAX_TAG_LENGTH = 100;
    public static final int MAX_REF_LENGTH = 255;
    public static final int MAX_CONTENT_RATING_LENGTH = 20;

    UUID id;
    String creator;
    String title;
    String description;
    String category;
    String contentRating;
    List<String> tags;
    String thumbnailRef;
    Set<Integer> qualityLevels;
    boolean monetized;
    long subscriptionPrice;
    boolean tipEnabled;
    Map<String, Integer> revenueSplits;
    StreamStatus status;
    long createdAt;
    long startedAt;
    long endedAt;
    long viewerCount;
    Balance balance;
    int moderationScore;
    String manifestRef;

    /**
     * Creates a new Stream in CREATED status with an empty balance and no viewers.
     *
     * @throws com.flagship.stream_ledger.exception.InvalidQualityException if a requested tier is unsupported
     * @throws IllegalArgumentException if the creator, price, tags, revenue splits or a
     *         free-text field is invalid
     */
    public static Stream create(UUID id, String creator, StreamConfig config, long now) {
        requireAddress(creator, "Creator");
        if (config.getTitle() == null || config.getTitle().isBlank()) {
            throw new IllegalArgumentException("Stream title is required");
        }
        Set<Integer> tiers = QualityLevel.requireSupported(config.getQualityLevels());
        if (config.getSubscriptionPrice() < 0) {
            throw new IllegalArgumentException("Subscription price cannot be negative");
        }
        Map<String, Integer> splits = validateRevenueSplits(config.getRevenueSplits());
        List<String> tags = validateTags(config.getTags());
        requireRefLength(config.getThumbnailRef(), "Thumbnail reference");
        if (config.getContentRating() != null && config.getContentRating().length() > MAX_CONTENT_RATING_LENGTH) {
            throw new IllegalArgumentException(
                String.format("Content rating must be at most %d characters", MAX_CONTENT_RATING_LENGTH));
        }

        return Stream.builder()
            .id(id)
            .creator(creator)
            .title(config.getTitle())
            .description(config.getDescription())
            .category(config.getCategory())
            .contentRating(config.getContentRating())
            .tags(tags)
            .thumbnailRef(config.getThumbnailRef())
            .qualityLevels(tiers)
            .monetized(config.isMonetized())
            .subscriptionPrice(config.getSubscriptionPrice())
            .tipEnabled(config.isTipEnabled())
            .revenueSplits(splits)
            .status(StreamStatus.CREATED)
            .createdAt(now)
            .startedAt(0L)
            .endedAt(0L)
            .viewerCount(0L)
            .balance(Balance.zero())
            .moderationScore(INITIAL_MODERATION_SCORE)
            .manifestRef("")
            .build();
    }

    /**
     * Transitions the stream to LIVE. Only the creator may start it, and only from CREATED.
     *
     * @return New Stream instance with LIVE status
     * @throws NotAuthorizedException if the caller is not the creator
     * @throws InvalidStateException if the stream is not in CREATED status
     */
    public Stream start(String caller, String manifestRef, long now) {
        requireCreator(caller);
        requireTransition(StreamStatus.LIVE, "start");
        requireRefLength(manifestRef, "Manifest reference");
        return toBuilder()
            .status(StreamStatus.LIVE)
            .startedAt(Math.max(now, createdAt))
            .manifestRef(manifestRef == null ? "" : manifestRef)
            .build();
    }

    /**
     * Transitions the stream to ENDED. Balance and viewer count are left untouched.
     *
     * @return New Stream instance with ENDED status
     * @throws NotAuthorizedException if the caller is not the creator
     * @throws InvalidStateException if the stream is not LIVE
     */
    public Stream end(String caller, long now) {
        requireCreator(caller);
        requireTransition(StreamStatus.ENDED, "end");
        return toBuilder()
            .status(StreamStatus.ENDED)
            .endedAt(Math.max(now, startedAt))
            .build();
    }

    /**
     * Moves an ended stream out of circulation.
     *
     * @throws NotAuthorizedException if the caller is not the creator
     * @throws InvalidStateException if the stream has not ended
     */
    public Stream archive(String caller) {
        requireCreator(caller);
        requireTransition(StreamStatus.ARCHIVED, "archive");
        return toBuilder()
            .status(StreamStatus.ARCHIVED)
            .build();
    }

    /**
     * Admits a viewer to a live stream.
     *
     * On a monetized stream a supplied payment must cover the subscription
     * price and is deposited in full. A payment supplied to a stream that is
     * not monetized is handed back untouched. The viewer count always grows.
     *
     * @param payment Amount offered by the viewer, or null when none is offered
     * @throws InvalidStateException if the stream is not LIVE, whatever the payment
     * @throws InsufficientPaymentException if the payment is below the subscription price
     */
    public Admission admit(Long payment) {
        if (status != StreamStatus.LIVE) {
            throw new InvalidStateException(
                String.format("Cannot join stream %s in %s status. Only LIVE streams can be joined.", id, status));
        }
        if (payment != null && payment < 0) {
            throw new IllegalArgumentException("Payment cannot be negative");
        }

        Balance newBalance = balance;
        long deposited = 0L;
        long refunded = 0L;
        boolean paid = false;

        if (payment != null) {
            if (monetized) {
                if (payment < subscriptionPrice) {
                    throw new InsufficientPaymentException(payment, subscriptionPrice);
                }
                newBalance = balance.deposit(payment);
                deposited = payment;
                paid = true;
            } else {
                refunded = payment;
            }
        }

        Stream admitted = toBuilder()
            .viewerCount(Math.addExact(viewerCount, 1L))
            .balance(newBalance)
            .build();
        return new Admission(admitted, paid, deposited, refunded);
    }

    /**
     * Deposits a tip. Tips bypass the subscription price; any positive amount is accepted.
     *
     * @throws InvalidStateException if tipping is disabled for this stream
     * @throws IllegalArgumentException if the amount is not positive
     */
    public Stream receiveTip(long amount) {
        if (!tipEnabled) {
            throw new InvalidStateException(String.format("Tips are disabled for stream %s", id));
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("Tip amount must be positive");
        }
        return toBuilder()
            .balance(balance.deposit(amount))
            .build();
    }

    /**
     * Withdraws the whole revenue balance for transfer to the creator.
     * A zero balance yields a zero payout and leaves the stream unchanged.
     *
     * Revenue splits are not consulted here.
     *
     * @throws NotAuthorizedException if the caller is not the creator
     */
    public Payout distribute(String caller) {
        requireCreator(caller);
        if (balance.isZero()) {
            return new Payout(this, 0L);
        }
        Balance.Withdrawal withdrawal = balance.withdrawAll();
        return new Payout(toBuilder().balance(withdrawal.getRemaining()).build(), withdrawal.getAmount());
    }

    /**
     * Sets the score reported by the moderation collaborator.
     */
    public Stream withModerationScore(int score) {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Moderation score must be between 0 and 100");
        }
        return toBuilder()
            .moderationScore(score)
            .build();
    }

    /**
     * @throws NotAuthorizedException if the caller is not the creator of this stream
     */
    public void requireCreator(String caller) {
        if (caller == null || !caller.equals(creator)) {
            throw new NotAuthorizedException(
                String.format("Caller %s is not the creator of stream %s", caller, id));
        }
    }

    public boolean isLive() {
        return status == StreamStatus.LIVE;
    }

    /**
     * Broadcast duration in milliseconds; 0 until the stream has ended.
     */
    public long getDurationMillis() {
        return endedAt == 0L ? 0L : endedAt - startedAt;
    }

    /**
     * Checks if a transition from current status to target status is allowed.
     */
    public boolean canTransitionTo(StreamStatus targetStatus) {
        return switch (this.status) {
            case CREATED -> targetStatus == StreamStatus.LIVE;
            case LIVE -> targetStatus == StreamStatus.ENDED;
            case ENDED -> targetStatus == StreamStatus.ARCHIVED;
            case ARCHIVED -> false;
        };
    }

    private void requireTransition(StreamStatus target, String operation) {
        if (!canTransitionTo(target)) {
            throw new InvalidStateException(
                String.format("Cannot %s stream %s in %s status. Only %s streams can be %s.",
                    operation, id, status, sourceOf(target), pastTense(operation)));
        }
    }

    /**
     * @throws IllegalArgumentException if the address is blank or wider than {@link #MAX_ADDRESS_LENGTH}
     */
    public static void requireAddress(String address, String role) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException(role + " address is required");
        }
        if (address.length() > MAX_ADDRESS_LENGTH) {
            throw new IllegalArgumentException(
                String.format("%s address must be at most %d characters", role, MAX_ADDRESS_LENGTH));
        }
    }

    static void requireRefLength(String ref, String name) {
        if (ref != null && ref.length() > MAX_REF_LENGTH) {
            throw new IllegalArgumentException(
                String.format("%s must be at most %d characters", name, MAX_REF_LENGTH));
        }
    }

    private static List<String> validateTags(List<String> tags) {
        if (tags == null) {
            return List.of();
        }
        for (String tag : tags) {
            if (tag == null || tag.isBlank()) {
                throw new IllegalArgumentException("Tags must not be blank");
            }
            if (tag.length() > MAX_TAG_LENGTH) {
                throw new IllegalArgumentException(
                    String.format("Tag must be at most %d characters", MAX_TAG_LENGTH));
            }
        }
        return List.copyOf(tags);
    }

    private static StreamStatus sourceOf(StreamStatus target) {
        return switch (target) {
            case LIVE -> StreamStatus.CREATED;
            case ENDED -> StreamStatus.LIVE;
            case ARCHIVED -> StreamStatus.ENDED;
            case CREATED -> throw new IllegalArgumentException("No transition leads to CREATED");
        };
    }

    private static String pastTense(String operation) {
        return switch (operation) {
            case "start" -> "started";
            case "end" -> "ended";
            default -> operation + "d";
        };
    }

    private static Map<String, Integer> validateRevenueSplits(Map<String, Integer> splits) {
        if (splits == null || splits.isEmpty()) {
            return Map.of();
        }
        long total = 0;
        for (Map.Entry<String, Integer> split : splits.entrySet()) {
            requireAddress(split.getKey(), "Revenue split recipient");
            Integer bps = split.getValue();
            if (bps == null || bps < 0 || bps > MAX_BASIS_POINTS) {
                throw new IllegalArgumentException(
                    String.format("Revenue split for %s must be between 0 and %d basis points",
                        split.getKey(), MAX_BASIS_POINTS));
            }
            total += bps;
        }
        if (total > MAX_BASIS_POINTS) {
            throw new IllegalArgumentException(
                String.format("Revenue splits total %d basis points, more than %d", total, MAX_BASIS_POINTS));
        }
        return Map.copyOf(splits);
    }

    /**
     * Outcome of admitting a viewer.
     */
    @Value
    public static class Admission {
        Stream stream;
        boolean paid;
        long deposited;
        long refunded;
    }

    /**
     * Outcome of a revenue distribution.
     */
    @Value
    public static class Payout {
        Stream stream;
        long amount;

        public boolean isEmpty() {
            return amount == 0L;
        }
    }
}
