package com.agentnet.hooks;

@FunctionalInterface
public interface VoteSigner {
    /**
     * Signs the given bytes with the local node's key
     *
     * @param data bytes to sign
     * @return the encoded signature
     * @throws SigningException if the key is unavailable or signing fails
     */
    String sign(byte[] data) throws SigningException;
}
