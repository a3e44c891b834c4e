package com.agentnet.config;

import java.time.Duration;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Tunables for one consensus manager. Build with {@link #builder()} and call
 * {@link #validate()} before use; the manager does so on construction.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ConsensusConfig {
    public static final int DEFAULT_MIN_COMMITTEE_SIZE = 4;
    public static final int DEFAULT_COMMITTEE_SIZE = 5;
    public static final int DEFAULT_MAX_COMMITTEE_SIZE = 11;
    public static final double DEFAULT_QUORUM_FRACTION = 0.67;
    public static final Duration DEFAULT_VOTING_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_PENDING_PROPOSALS = 100;
    public static final int DEFAULT_ROTATION_INTERVAL = 100;

    @Builder.Default
    private final int minCommitteeSize = DEFAULT_MIN_COMMITTEE_SIZE;
    @Builder.Default
    private final int defaultCommitteeSize = DEFAULT_COMMITTEE_SIZE;
    @Builder.Default
    private final int maxCommitteeSize = DEFAULT_MAX_COMMITTEE_SIZE;
    @Builder.Default
    private final double quorumFraction = DEFAULT_QUORUM_FRACTION;
    @Builder.Default
    private final Duration votingTimeout = DEFAULT_VOTING_TIMEOUT;
    @Builder.Default
    private final int maxPendingProposals = DEFAULT_MAX_PENDING_PROPOSALS;
    // events between leader rotations, counted by the host
    @Builder.Default
    private final int rotationInterval = DEFAULT_ROTATION_INTERVAL;
    // how long terminal proposals are kept by the periodic sweep
    @Builder.Default
    private final Duration retention = Duration.ofHours(1);
    @Builder.Default
    private final Duration sweepInterval = Duration.ofSeconds(1);

    public static ConsensusConfig defaults() {
        return builder().build();
    }

    /**
     * @throws IllegalArgumentException if any value is out of range
     */
    public ConsensusConfig validate() {
        if (minCommitteeSize < 1) {
            throw new IllegalArgumentException("minCommitteeSize must be at least 1: " + minCommitteeSize);
        }
        if (maxCommitteeSize < minCommitteeSize) {
            throw new IllegalArgumentException(
                    "maxCommitteeSize " + maxCommitteeSize + " is below minCommitteeSize " + minCommitteeSize);
        }
        if (defaultCommitteeSize < minCommitteeSize || defaultCommitteeSize > maxCommitteeSize) {
            throw new IllegalArgumentException("defaultCommitteeSize " + defaultCommitteeSize
                    + " is outside [" + minCommitteeSize + ", " + maxCommitteeSize + "]");
        }
        if (!(quorumFraction > 0.0 && quorumFraction <= 1.0)) {
            throw new IllegalArgumentException("quorumFraction must be in (0, 1]: " + quorumFraction);
        }
        requirePositive(votingTimeout, "votingTimeout");
        requirePositive(retention, "retention");
        requirePositive(sweepInterval, "sweepInterval");
        if (maxPendingProposals < 1) {
            throw new IllegalArgumentException("maxPendingProposals must be positive: " + maxPendingProposals);
        }
        if (rotationInterval < 1) {
            throw new IllegalArgumentException("rotationInterval must be positive: " + rotationInterval);
        }
        return this;
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration: " + value);
        }
    }
}
