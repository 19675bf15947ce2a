package com.bbthechange.roomsync.controller;

import com.bbthechange.roomsync.dto.AppServiceTransaction;
import com.bbthechange.roomsync.exception.RoomSyncException;
import com.bbthechange.roomsync.identity.TenantRoomIdentity;
import com.bbthechange.roomsync.model.RoomHandle;
import com.bbthechange.roomsync.service.RoomLifecycleManager;
import com.bbthechange.roomsync.service.UserRoomSyncService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Application service endpoints the homeserver calls back into.
 * Tenant and entity are resolved from the identifier alone; there is no session on these calls.
 * Failures never leak: the homeserver only ever sees an empty object or a not-found error.
 */
@RestController
@RequestMapping("/matrix/appservice")
@Tag(name = "Federation", description = "Homeserver application service callbacks")
public class AppServiceController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(AppServiceController.class);

    private final RoomLifecycleManager roomLifecycleManager;
    private final UserRoomSyncService userRoomSyncService;
    private final TenantRoomIdentity identity;

    @Autowired
    public AppServiceController(RoomLifecycleManager roomLifecycleManager,
                                UserRoomSyncService userRoomSyncService,
                                TenantRoomIdentity identity) {
        this.roomLifecycleManager = roomLifecycleManager;
        this.userRoomSyncService = userRoomSyncService;
        this.identity = identity;
    }

    @GetMapping({"/rooms/{alias}", "/_matrix/app/v1/rooms/{alias}"})
    @Operation(summary = "Query a room alias",
               description = "Creates the room for the entity the alias names, if the entity exists.")
    public ResponseEntity<Map<String, Object>> queryRoom(
            @Parameter(description = "Room alias, e.g. #event-foo-t1:server") @PathVariable String alias) {
        try {
            RoomHandle handle = roomLifecycleManager.ensureByAlias(alias);
            logger.debug("Room query for {} resolved to {}", alias, handle.roomId());
            return ResponseEntity.ok(Map.of());
        } catch (RoomSyncException e) {
            logger.info("Room query for {} failed ({}): {}", alias, e.getFailureKind(), e.getMessage());
            return roomNotFound();
        } catch (RuntimeException e) {
            logger.error("Unexpected failure answering room query for {}", alias, e);
            return roomNotFound();
        }
    }

    @GetMapping({"/users/{userId}", "/_matrix/app/v1/users/{userId}"})
    @Operation(summary = "Query a user id", description = "Accepts any well-formed user id in the tenant namespace.")
    public ResponseEntity<Map<String, Object>> queryUser(@PathVariable String userId) {
        if (identity.parseUserId(userId).isEmpty()) {
            logger.debug("User query rejected for {}", userId);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "User not found"));
        }
        return ResponseEntity.ok(Map.of());
    }

    @PutMapping({"/transactions/{txnId}", "/_matrix/app/v1/transactions/{txnId}"})
    @Operation(summary = "Receive pushed events",
               description = "A user's own join brings them into the rooms of all their events and groups. "
                   + "The transaction is always acknowledged.")
    public ResponseEntity<Map<String, Object>> pushTransaction(
            @PathVariable String txnId,
            @RequestBody(required = false) AppServiceTransaction transaction) {
        List<Map<String, Object>> events = transaction != null && transaction.getEvents() != null
            ? transaction.getEvents()
            : List.of();
        for (Map<String, Object> event : events) {
            try {
                userRoomSyncService.handleEvent(event);
            } catch (RuntimeException e) {
                logger.error("Failed to handle {} event in transaction {}", event.get("type"), txnId, e);
            }
        }
        logger.debug("Acknowledged transaction {} with {} events", txnId, events.size());
        return ResponseEntity.ok(Map.of());
    }

    @GetMapping("/_matrix/app/v1/thirdparty/protocol/{protocol}")
    public ResponseEntity<Map<String, Object>> thirdPartyProtocol(@PathVariable String protocol) {
        return ResponseEntity.ok(Map.of());
    }

    @GetMapping({"/_matrix/app/v1/thirdparty/location", "/_matrix/app/v1/thirdparty/location/{protocol}",
                 "/_matrix/app/v1/thirdparty/user", "/_matrix/app/v1/thirdparty/user/{protocol}"})
    public ResponseEntity<List<Object>> thirdPartyLookup() {
        return ResponseEntity.ok(List.of());
    }

    private static ResponseEntity<Map<String, Object>> roomNotFound() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Room not found"));
    }
}
