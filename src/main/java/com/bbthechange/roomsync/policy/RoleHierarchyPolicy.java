package com.bbthechange.roomsync.policy;

import com.bbthechange.roomsync.model.HierarchyDecision;
import com.bbthechange.roomsync.model.HierarchyRule;
import com.bbthechange.roomsync.model.MemberRole;
import com.bbthechange.roomsync.model.MembershipIntent;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Decides who may change or remove whose membership role.
 *
 * The table is asymmetric on purpose: an admin may act on another admin but not on an owner,
 * and a moderator may not touch admins at all. It is evaluated rule by rule in a fixed order
 * rather than by comparing ranks, because the lateral admin-on-admin case is allowed while
 * every other equal-rank case is not.
 *
 * No I/O; safe to call from anywhere.
 */
@Component
public class RoleHierarchyPolicy {

    private static final Set<MemberRole> MODERATOR_MANAGEABLE = EnumSet.of(MemberRole.MEMBER, MemberRole.GUEST);

    /**
     * A target with no role yet is treated as an outsider at guest level.
     */
    private static final MemberRole NO_ROLE = MemberRole.GUEST;

    public boolean canChangeRole(MemberRole actorRole, MemberRole targetCurrentRole, MemberRole desiredRole) {
        return evaluateChange(actorRole, targetCurrentRole, desiredRole).allowed();
    }

    /**
     * String form used at the API edge. Unrecognized names are rejected as invalid input
     * before any hierarchy rule is consulted.
     */
    public HierarchyDecision evaluateChange(String actorRole, String targetCurrentRole, String desiredRole) {
        Optional<MemberRole> actor = MemberRole.fromName(actorRole);
        Optional<MemberRole> target = MemberRole.fromName(targetCurrentRole);
        Optional<MemberRole> desired = MemberRole.fromName(desiredRole);

        if (actor.isEmpty()) {
            return HierarchyDecision.invalid("Unrecognized actor role: " + actorRole);
        }
        if (target.isEmpty()) {
            return HierarchyDecision.invalid("Unrecognized target role: " + targetCurrentRole);
        }
        if (desired.isEmpty()) {
            return HierarchyDecision.invalid("Unrecognized desired role: " + desiredRole);
        }
        return evaluateChange(actor.get(), target.get(), desired.get());
    }

    public HierarchyDecision evaluateChange(MemberRole actorRole, MemberRole targetCurrentRole, MemberRole desiredRole) {
        if (actorRole == null || desiredRole == null) {
            return HierarchyDecision.invalid("Actor role and desired role are required");
        }
        MemberRole target = targetCurrentRole == null ? NO_ROLE : targetCurrentRole;

        // 1. Owners are unrestricted
        if (actorRole == MemberRole.OWNER) {
            return HierarchyDecision.allow(HierarchyRule.OWNER_UNRESTRICTED);
        }
        // 2. Only owners touch owners
        if (target == MemberRole.OWNER) {
            return HierarchyDecision.deny(HierarchyRule.OWNER_TARGET_PROTECTED);
        }
        // 3. Only owners grant ownership
        if (desiredRole == MemberRole.OWNER) {
            return HierarchyDecision.deny(HierarchyRule.OWNER_GRANT_RESTRICTED);
        }

        switch (actorRole) {
            case ADMIN:
                // 4. Admin on admin is an allowed lateral move
                return target.isAtMost(MemberRole.ADMIN) && desiredRole.isAtMost(MemberRole.ADMIN)
                    ? HierarchyDecision.allow(HierarchyRule.ADMIN_SCOPE)
                    : HierarchyDecision.deny(HierarchyRule.ADMIN_SCOPE);
            case MODERATOR:
                // 5. Moderators manage members and guests only
                return MODERATOR_MANAGEABLE.contains(target) && MODERATOR_MANAGEABLE.contains(desiredRole)
                    ? HierarchyDecision.allow(HierarchyRule.MODERATOR_SCOPE)
                    : HierarchyDecision.deny(HierarchyRule.MODERATOR_SCOPE);
            default:
                // 6. Members and guests have no authority, not even over themselves
                return HierarchyDecision.deny(HierarchyRule.NO_ROLE_AUTHORITY);
        }
    }

    /**
     * Decide whether the actor may remove the target. Leaving is always allowed; removing someone
     * else follows the same target constraints as a role change.
     */
    public HierarchyDecision evaluateRemoval(MemberRole actorRole, MemberRole targetCurrentRole, boolean self) {
        if (self) {
            return HierarchyDecision.allow(HierarchyRule.SELF_REMOVAL);
        }
        if (actorRole == null) {
            return HierarchyDecision.invalid("Actor role is required");
        }
        MemberRole target = targetCurrentRole == null ? NO_ROLE : targetCurrentRole;

        if (actorRole == MemberRole.OWNER) {
            return HierarchyDecision.allow(HierarchyRule.OWNER_UNRESTRICTED);
        }
        if (target == MemberRole.OWNER) {
            return HierarchyDecision.deny(HierarchyRule.OWNER_TARGET_PROTECTED);
        }
        switch (actorRole) {
            case ADMIN:
                return HierarchyDecision.allow(HierarchyRule.ADMIN_SCOPE);
            case MODERATOR:
                return MODERATOR_MANAGEABLE.contains(target)
                    ? HierarchyDecision.allow(HierarchyRule.MODERATOR_SCOPE)
                    : HierarchyDecision.deny(HierarchyRule.MODERATOR_SCOPE);
            default:
                return HierarchyDecision.deny(HierarchyRule.NO_ROLE_AUTHORITY);
        }
    }

    /**
     * Evaluate a full membership intent: removal rules when the desired role is absent,
     * otherwise the self-promotion guard followed by the change table.
     * Intents that leave the role unchanged need no authority and are allowed.
     */
    public HierarchyDecision evaluate(MembershipIntent intent) {
        if (intent.isRemoval()) {
            return evaluateRemoval(intent.actorRole(), intent.targetCurrentRole(), intent.isSelf());
        }
        if (!intent.changesRole()) {
            return HierarchyDecision.allow(HierarchyRule.UNCHANGED);
        }
        MemberRole current = intent.targetCurrentRole() == null ? NO_ROLE : intent.targetCurrentRole();
        if (intent.isSelf() && intent.desiredRole().isAbove(current) && intent.actorRole() != MemberRole.OWNER) {
            return HierarchyDecision.deny(HierarchyRule.SELF_PROMOTION);
        }
        return evaluateChange(intent.actorRole(), intent.targetCurrentRole(), intent.desiredRole());
    }
}
