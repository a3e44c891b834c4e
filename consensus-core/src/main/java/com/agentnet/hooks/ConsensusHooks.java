package com.agentnet.hooks;

import lombok.Builder;
import lombok.Getter;

/**
 * Capabilities the host supplies to a consensus manager. Every hook is optional:
 * without a signer votes carry an empty signature, without a verifier remote votes are
 * counted unchecked, without a broadcaster nothing is sent.
 */
@Getter
@Builder
public class ConsensusHooks {
    private final VoteSigner signer;
    private final SignatureVerifier verifier;
    private final Broadcaster broadcaster;
    private final ReputationLookup reputationLookup;

    public static ConsensusHooks none() {
        return builder().build();
    }
}
