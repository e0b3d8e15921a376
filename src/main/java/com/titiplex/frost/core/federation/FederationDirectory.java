package com.titiplex.frost.core.federation;

/**
 * Read side of the federation records the coordinator trusts for group public keys.
 */
public interface FederationDirectory {
    void registerFederation(String groupId, String name, String groupPublicKey);

    /**
     * @return the group public key hex, or null if the federation is unknown
     */
    String findGroupPublicKey(String groupId);
}
