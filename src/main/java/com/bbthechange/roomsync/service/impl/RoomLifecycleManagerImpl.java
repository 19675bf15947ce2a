package com.bbthechange.roomsync.service.impl;

import com.bbthechange.roomsync.client.ChatNetworkClient;
import com.bbthechange.roomsync.client.CreateRoomOptions;
import com.bbthechange.roomsync.config.MatrixProperties;
import com.bbthechange.roomsync.exception.ChatNetworkException;
import com.bbthechange.roomsync.exception.RepositoryException;
import com.bbthechange.roomsync.exception.RoomSyncException;
import com.bbthechange.roomsync.identity.TenantRoomIdentity;
import com.bbthechange.roomsync.model.EntityType;
import com.bbthechange.roomsync.model.FailureKind;
import com.bbthechange.roomsync.model.RoomAliasInfo;
import com.bbthechange.roomsync.model.RoomHandle;
import com.bbthechange.roomsync.model.RoomRecord;
import com.bbthechange.roomsync.repository.EntityDirectory;
import com.bbthechange.roomsync.repository.RoomRecordRepository;
import com.bbthechange.roomsync.service.RoomLifecycleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Ensure/repoint/retire for entity rooms.
 *
 * No locks are taken. Concurrent ensures for the same entity race on room creation; the homeserver
 * lets exactly one create claim the alias and the losers adopt the winner's room by re-resolving it.
 * The record write is a keyed put, so racing writers overwrite one row with the same room id.
 */
@Service
public class RoomLifecycleManagerImpl implements RoomLifecycleManager {

    private static final Logger logger = LoggerFactory.getLogger(RoomLifecycleManagerImpl.class);

    private final ChatNetworkClient chatClient;
    private final RoomRecordRepository roomRecordRepository;
    private final EntityDirectory entityDirectory;
    private final TenantRoomIdentity identity;
    private final MatrixProperties matrixProperties;

    @Autowired
    public RoomLifecycleManagerImpl(ChatNetworkClient chatClient,
                                    RoomRecordRepository roomRecordRepository,
                                    EntityDirectory entityDirectory,
                                    TenantRoomIdentity identity,
                                    MatrixProperties matrixProperties) {
        this.chatClient = chatClient;
        this.roomRecordRepository = roomRecordRepository;
        this.entityDirectory = entityDirectory;
        this.identity = identity;
        this.matrixProperties = matrixProperties;
    }

    @Override
    public RoomHandle ensure(String tenantId, EntityType entityType, String entitySlug) {
        String alias = identity.buildAlias(tenantId, entityType, entitySlug);
        Optional<RoomRecord> cached = loadRecord(tenantId, entityType, entitySlug);

        // Network first: the cached record may point at a room that was since deleted or replaced
        Optional<String> existingRoom = resolveAlias(alias);
        if (existingRoom.isPresent()) {
            // Without a live record the alias may be a leftover of a slug change or a deleted entity
            boolean liveRecord = cached.isPresent() && !cached.get().isRetired();
            if (!liveRecord && !entityExists(tenantId, entityType, entitySlug)) {
                throw RoomSyncException.notFound("No " + entityType + " " + entitySlug + " in tenant " + tenantId
                    + " for room " + existingRoom.get());
            }
            String roomId = existingRoom.get();
            if (cached.isPresent() && !roomId.equals(cached.get().getExternalRoomId())) {
                logger.info("Room for {}/{} in tenant {} changed from {} to {}",
                    entityType, entitySlug, tenantId, cached.get().getExternalRoomId(), roomId);
            }
            persist(cached.orElseGet(() -> new RoomRecord(tenantId, entityType, entitySlug, roomId, alias)), roomId);
            return new RoomHandle(roomId, alias, false);
        }

        if (!entityExists(tenantId, entityType, entitySlug)) {
            throw RoomSyncException.notFound("No " + entityType + " " + entitySlug + " in tenant " + tenantId);
        }

        boolean recreated = true;
        String roomId;
        try {
            roomId = chatClient.createRoom(new CreateRoomOptions(
                identity.aliasLocalpart(tenantId, entityType, entitySlug),
                entityType.getValue() + " " + entitySlug,
                matrixProperties.getRoomPreset(),
                identity.botUserId(tenantId),
                matrixProperties.getAdminPowerLevel()));
            logger.info("Created room {} for {}/{} in tenant {}", roomId, entityType, entitySlug, tenantId);
        } catch (ChatNetworkException e) {
            if (e.getErrorType() != ChatNetworkException.ErrorType.ROOM_IN_USE) {
                throw RoomSyncException.fromNetwork("Room creation for " + alias, e);
            }
            // Another caller created it between our resolve and create
            logger.warn("Alias {} already in use, adopting the existing room", alias);
            recreated = false;
            roomId = resolveAlias(alias).orElseThrow(() -> RoomSyncException.transientFailure(
                "Alias " + alias + " reported in use but does not resolve yet", e));
        }

        String createdRoomId = roomId;
        persist(cached.orElseGet(() -> new RoomRecord(tenantId, entityType, entitySlug, createdRoomId, alias)), roomId);
        return new RoomHandle(roomId, alias, recreated);
    }

    @Override
    public RoomHandle ensureByAlias(String alias) {
        RoomAliasInfo info = identity.parseAlias(alias)
            .orElseThrow(() -> RoomSyncException.notFound("Room alias is not in the tenant namespace: " + alias));
        return ensure(info.tenantId(), info.entityType(), info.entitySlug());
    }

    @Override
    public RoomHandle changeSlug(String tenantId, EntityType entityType, String oldSlug, String newSlug) {
        if (oldSlug.equals(newSlug)) {
            return ensure(tenantId, entityType, newSlug);
        }
        String newAlias = identity.buildAlias(tenantId, entityType, newSlug);

        RoomHandle current;
        try {
            current = ensure(tenantId, entityType, oldSlug);
        } catch (RoomSyncException e) {
            if (e.getFailureKind() != FailureKind.NOT_FOUND) {
                throw e;
            }
            // The entity already lives under the new slug and never had a room under the old one
            logger.info("No room under old slug {} in tenant {}, ensuring under {}", oldSlug, tenantId, newSlug);
            return ensure(tenantId, entityType, newSlug);
        }

        String roomId = current.roomId();
        registerAlias(newAlias, roomId);

        RoomRecord record = loadRecord(tenantId, entityType, oldSlug)
            .orElseGet(() -> new RoomRecord(tenantId, entityType, oldSlug, roomId, current.alias()));
        record.repoint(entityType, newSlug, newAlias);

        try {
            chatClient.setCanonicalAlias(roomId, newAlias, record.getAltAliases(), identity.botUserId(tenantId));
        } catch (ChatNetworkException e) {
            throw RoomSyncException.fromNetwork("Setting canonical alias " + newAlias, e);
        }

        try {
            roomRecordRepository.move(record, entityType, oldSlug);
        } catch (RepositoryException e) {
            throw RoomSyncException.transientFailure("Could not store slug change for room " + roomId, e);
        }

        logger.info("Repointed room {} from {} to {} in tenant {}", roomId, current.alias(), newAlias, tenantId);
        return new RoomHandle(roomId, newAlias, current.recreated());
    }

    @Override
    public void retire(String tenantId, EntityType entityType, String entitySlug) {
        Optional<RoomRecord> record = loadRecord(tenantId, entityType, entitySlug);
        if (record.isEmpty()) {
            logger.debug("No room record to retire for {}/{} in tenant {}", entityType, entitySlug, tenantId);
            return;
        }
        RoomRecord retired = record.get();
        retired.retire();
        try {
            roomRecordRepository.save(retired);
        } catch (RepositoryException e) {
            throw RoomSyncException.transientFailure("Could not retire room record for " + entitySlug, e);
        }
        logger.info("Retired room {} for {}/{} in tenant {}", retired.getExternalRoomId(), entityType, entitySlug, tenantId);
    }

    @Override
    public Optional<RoomRecord> findRoom(String tenantId, EntityType entityType, String entitySlug) {
        return loadRecord(tenantId, entityType, entitySlug);
    }

    private Optional<String> resolveAlias(String alias) {
        try {
            return chatClient.resolveAlias(alias);
        } catch (ChatNetworkException e) {
            throw RoomSyncException.fromNetwork("Alias lookup for " + alias, e);
        }
    }

    private void registerAlias(String alias, String roomId) {
        try {
            chatClient.registerAlias(alias, roomId);
        } catch (ChatNetworkException e) {
            if (e.getErrorType() != ChatNetworkException.ErrorType.ROOM_IN_USE) {
                throw RoomSyncException.fromNetwork("Alias registration for " + alias, e);
            }
            String owner = resolveAlias(alias).orElse(null);
            if (!roomId.equals(owner)) {
                throw RoomSyncException.permissionUnavailable("Alias " + alias + " already belongs to room " + owner);
            }
            logger.debug("Alias {} already points at room {}", alias, roomId);
        }
    }

    private Optional<RoomRecord> loadRecord(String tenantId, EntityType entityType, String entitySlug) {
        try {
            return roomRecordRepository.findByEntity(tenantId, entityType, entitySlug);
        } catch (RepositoryException e) {
            throw RoomSyncException.transientFailure("Room record lookup failed for " + entitySlug, e);
        }
    }

    private boolean entityExists(String tenantId, EntityType entityType, String entitySlug) {
        try {
            return entityDirectory.entityExists(tenantId, entityType, entitySlug);
        } catch (RepositoryException e) {
            throw RoomSyncException.transientFailure("Entity lookup failed for " + entitySlug, e);
        }
    }

    private void persist(RoomRecord record, String roomId) {
        record.adoptRoom(roomId);
        try {
            roomRecordRepository.save(record);
        } catch (RepositoryException e) {
            // The room exists on the network, so the next ensure recovers by resolving the alias
            throw RoomSyncException.transientFailure("Could not store room record for room " + roomId, e);
        }
    }
}
