package com.ivamare.eventbus.model;

/**
 * Well-known event types shared between services.
 */
public final class EventTypes {

    private EventTypes() {
    }

    // User events
    public static final String USER_CREATED = "user.created";
    public static final String USER_UPDATED = "user.updated";
    public static final String USER_DELETED = "user.deleted";
    public static final String USER_LOGIN = "user.login";
    public static final String USER_LOGOUT = "user.logout";

    // Payment events
    public static final String PAYMENT_CREATED = "payment.created";
    public static final String PAYMENT_COMPLETED = "payment.completed";
    public static final String PAYMENT_FAILED = "payment.failed";

    // Account events
    public static final String ACCOUNT_CREATED = "account.created";
    public static final String ACCOUNT_UPDATED = "account.updated";
    public static final String APPLICATION_STATUS_UPDATED = "application.status.updated";
    public static final String APPLICATION_STATUS_SUBMITTED = "application.status.submitted";

    // Application events
    public static final String APPLICATION_CREATED = "application.created";
    public static final String APPLICATION_UPDATED = "application.updated";
    public static final String APPLICATION_SUBMITTED = "application.submitted";
    public static final String APPLICATION_APPROVED = "application.approved";
    public static final String APPLICATION_REJECTED = "application.rejected";

    // Portal events
    public static final String PORTAL_APPLICATION_CREATED = "portal.application.created";
    public static final String PORTAL_APPLICATION_UPDATED = "portal.application.updated";
    public static final String PROFILE_APPLICATION_CREATE = "profile.application.create";

    // Profile events
    public static final String PROFILE_CREATED = "profile.created";
    public static final String PROFILE_UPDATED = "profile.updated";
    public static final String PROFILE_DELETED = "profile.deleted";
}
