package com.soora.shop.domain.model;

/**
 * Customer loyalty segment.
 * Assigned by administrators; it does not grant any permission (see {@link User.Role}).
 *
 * @author Soora Platform Team
 */
public enum CustomerTier {
    /**
     * Default tier for new accounts.
     */
    REGULAR,

    SILVER,

    GOLD,

    /**
     * Highest spend segment.
     */
    VIP
}
