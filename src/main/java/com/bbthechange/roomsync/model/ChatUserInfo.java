package com.bbthechange.roomsync.model;

/**
 * Tenant and user slug recovered from a chat network user id.
 */
public record ChatUserInfo(String userSlug, String tenantId, String userId) {
}
