package com.zktune.tunebackend.gate.dto;

/**
 * Outcome of an access request that did not fail.
 *
 * @param granted      always true; failures are thrown
 * @param settled      true when this call took a payment and issued the grant, false when an earlier
 *                     grant was reused
 * @param royaltyShare amount credited to escrow by this call
 */
public record AccessResult(boolean granted, boolean settled, long royaltyShare) {

    public static AccessResult existingGrant() {
        return new AccessResult(true, false, 0);
    }

    public static AccessResult settled(long royaltyShare) {
        return new AccessResult(true, true, royaltyShare);
    }
}
