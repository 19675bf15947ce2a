package com.bbthechange.roomsync.service.impl;

import com.bbthechange.roomsync.client.ChatNetworkClient;
import com.bbthechange.roomsync.client.RoomPowerLevels;
import com.bbthechange.roomsync.config.MatrixProperties;
import com.bbthechange.roomsync.exception.ChatNetworkException;
import com.bbthechange.roomsync.exception.ChatNetworkException.ErrorType;
import com.bbthechange.roomsync.identity.TenantRoomIdentity;
import com.bbthechange.roomsync.model.BotPermissionSnapshot;
import com.bbthechange.roomsync.service.BotPermissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Diagnose, heal and re-verify the bot's privileges in a room.
 *
 * Authority is probed by actually inviting and kicking rather than by reading power levels,
 * since room-specific rules (custom invite/kick levels, bans) make the levels alone unreliable.
 * Elevation is written as the application service sender, which outranks the per-tenant bots.
 */
@Service
public class BotPermissionServiceImpl implements BotPermissionService {

    private static final Logger logger = LoggerFactory.getLogger(BotPermissionServiceImpl.class);

    private static final String PROBE_USER_PREFIX = "permission-probe-";
    private static final String PROBE_KICK_REASON = "Permission probe";

    private final ChatNetworkClient chatClient;
    private final TenantRoomIdentity identity;
    private final MatrixProperties matrixProperties;

    @Autowired
    public BotPermissionServiceImpl(ChatNetworkClient chatClient,
                                    TenantRoomIdentity identity,
                                    MatrixProperties matrixProperties) {
        this.chatClient = chatClient;
        this.identity = identity;
        this.matrixProperties = matrixProperties;
    }

    @Override
    public BotPermissionSnapshot diagnose(String tenantId, String roomId, String probeUserId) {
        String botUserId = identity.botUserId(tenantId);
        BotPermissionSnapshot snapshot = new BotPermissionSnapshot(roomId, botUserId);
        ProbeTally tally = new ProbeTally();
        // The bot is always in its own rooms, so inviting itself is a harmless probe
        String inviteTarget = probeUserId != null ? probeUserId : botUserId;

        // 1. Current level
        RoomPowerLevels initialLevels = readPowerLevels(roomId, botUserId, snapshot, tally);
        if (initialLevels != null) {
            snapshot.setCurrentPowerLevel(initialLevels.levelOf(botUserId));
        }

        // 2-3. Probe invite and kick authority
        snapshot.setCanInvite(probeInvite(roomId, inviteTarget, botUserId, snapshot, tally));
        snapshot.setCanKick(probeKick(tenantId, roomId, botUserId, snapshot, tally));

        // 4. Heal and re-verify
        if (!snapshot.isCanInvite() || !snapshot.isCanKick()) {
            snapshot.setFixAttempted(true);
            logger.warn("Bot {} lacks authority in room {} (invite={}, kick={}), attempting elevation",
                botUserId, roomId, snapshot.isCanInvite(), snapshot.isCanKick());

            if (heal(tenantId, roomId)) {
                boolean canInviteNow = probeInvite(roomId, inviteTarget, botUserId, snapshot, tally);
                snapshot.setCanInvite(canInviteNow);
                snapshot.setFixSucceeded(canInviteNow);
            } else {
                snapshot.addError("Failed to elevate bot power level in room " + roomId);
            }
        }

        // 5. Read back
        RoomPowerLevels finalLevels = readPowerLevels(roomId, botUserId, snapshot, tally);
        if (finalLevels != null) {
            int level = finalLevels.levelOf(botUserId);
            snapshot.setFinalPowerLevel(level);
            snapshot.setCanModifyPowerLevels(level >= finalLevels.requiredForStateEvent(
                RoomPowerLevels.POWER_LEVELS_EVENT, matrixProperties.getPowerLevelThreshold()));
        }

        snapshot.setNetworkUnavailable(tally.allTransient());
        if (snapshot.isHealthy()) {
            logger.debug("Bot {} healthy in room {}", botUserId, roomId);
        } else {
            logger.warn("Bot {} permission check for room {} finished with errors: {}",
                botUserId, roomId, snapshot.getErrors());
        }
        return snapshot;
    }

    @Override
    public boolean heal(String tenantId, String roomId) {
        String botUserId = identity.botUserId(tenantId);
        try {
            chatClient.setUserPowerLevels(roomId, Map.of(botUserId, matrixProperties.getAdminPowerLevel()), null);
            logger.info("Elevated bot {} to power level {} in room {}",
                botUserId, matrixProperties.getAdminPowerLevel(), roomId);
            return true;
        } catch (ChatNetworkException e) {
            logger.warn("Could not elevate bot {} in room {}: {}", botUserId, roomId, e.getMessage());
            return false;
        }
    }

    private RoomPowerLevels readPowerLevels(String roomId, String botUserId,
                                            BotPermissionSnapshot snapshot, ProbeTally tally) {
        try {
            RoomPowerLevels levels = chatClient.getPowerLevels(roomId, botUserId);
            tally.succeeded();
            return levels;
        } catch (ChatNetworkException e) {
            tally.failed(e);
            snapshot.addError("Failed to read power levels: " + e.getMessage());
            return null;
        }
    }

    private boolean probeInvite(String roomId, String probeUserId, String botUserId,
                                BotPermissionSnapshot snapshot, ProbeTally tally) {
        try {
            chatClient.invite(roomId, probeUserId, botUserId);
            tally.succeeded();
            return true;
        } catch (ChatNetworkException e) {
            if (e.getErrorType() == ErrorType.ALREADY_MEMBER) {
                tally.succeeded();
                return true;
            }
            tally.failed(e);
            snapshot.addError("Invite probe failed: " + e.getMessage());
            return false;
        }
    }

    /**
     * Kick a user that cannot be in the room. "Not a member" means the bot got past the power check.
     */
    private boolean probeKick(String tenantId, String roomId, String botUserId,
                              BotPermissionSnapshot snapshot, ProbeTally tally) {
        String probeUser = identity.buildUserId(tenantId,
            PROBE_USER_PREFIX + UUID.randomUUID().toString().replace("-", ""));
        try {
            chatClient.kick(roomId, probeUser, PROBE_KICK_REASON, botUserId);
            tally.succeeded();
            return true;
        } catch (ChatNetworkException e) {
            if (e.getErrorType() == ErrorType.NOT_MEMBER || e.getErrorType() == ErrorType.NOT_FOUND) {
                tally.succeeded();
                return true;
            }
            tally.failed(e);
            snapshot.addError("Kick probe failed: " + e.getMessage());
            return false;
        }
    }

    /**
     * Counts network steps so a fully unreachable homeserver can be told apart from missing privileges.
     */
    private static class ProbeTally {
        private int attempts;
        private int transientFailures;

        void succeeded() {
            attempts++;
        }

        void failed(ChatNetworkException e) {
            attempts++;
            if (e.isTransient()) {
                transientFailures++;
            }
        }

        boolean allTransient() {
            return attempts > 0 && transientFailures == attempts;
        }
    }
}
