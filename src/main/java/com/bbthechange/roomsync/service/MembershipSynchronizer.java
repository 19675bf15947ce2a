package com.bbthechange.roomsync.service;

import com.bbthechange.roomsync.model.EntityRef;
import com.bbthechange.roomsync.model.MembershipIntent;
import com.bbthechange.roomsync.model.SyncResult;

/**
 * The one place local membership changes are pushed into chat rooms.
 */
public interface MembershipSynchronizer {

    /**
     * Authorize, ensure the room, verify bot permissions and mutate membership, in that order.
     * Stops at the first blocking failure and reports it; never reports success after a partial mutation.
     */
    SyncResult apply(EntityRef owner, MembershipIntent intent);
}
