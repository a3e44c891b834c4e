package com.agentnet.hooks;

@FunctionalInterface
public interface SignatureVerifier {
    /**
     * Checks a signature produced by the given node
     *
     * @param nodeId    id of the claimed signer
     * @param data      the signed bytes
     * @param signature the encoded signature
     * @return true if the signature is valid for that node
     */
    boolean verify(String nodeId, byte[] data, String signature);
}
