package com.soora.shop.security;

import com.soora.shop.domain.model.Address;
import com.soora.shop.exception.ResourceNotFoundException;

/**
 * Authorization checks applied by services to resources that belong to a user.
 *
 * @author Soora Platform Team
 */
public final class AccessPolicy {

    private AccessPolicy() {
    }

    /**
     * Require the caller to own the resource.
     * A mismatch is reported exactly like a missing row, so non-owners cannot discover which IDs exist.
     *
     * @param caller Current caller
     * @param ownerUserId Owner of the resource
     * @param resourceType Resource name used in the not-found message
     * @param resourceId Resource ID
     * @throws ResourceNotFoundException if the caller is not the owner
     */
    public static void requireOwner(CallerContext caller, String ownerUserId,
                                    String resourceType, String resourceId) {
        if (caller == null || ownerUserId == null || !ownerUserId.equals(caller.getUserId())) {
            throw new ResourceNotFoundException(resourceType, resourceId);
        }
    }

    /**
     * Require the caller to own the address.
     *
     * @throws ResourceNotFoundException if the caller is not the owner
     */
    public static void requireOwner(CallerContext caller, Address address) {
        if (caller == null || !address.isOwnedBy(caller.getUserId())) {
            throw new ResourceNotFoundException("Address", address.getId());
        }
    }
}
