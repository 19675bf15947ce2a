package com.bbthechange.roomsync.controller;

import com.bbthechange.roomsync.dto.AddChatMemberRequest;
import com.bbthechange.roomsync.dto.ChangeRoleRequest;
import com.bbthechange.roomsync.dto.ChangeSlugRequest;
import com.bbthechange.roomsync.dto.MembershipSyncResponse;
import com.bbthechange.roomsync.dto.RoomHandleResponse;
import com.bbthechange.roomsync.exception.RoomSyncException;
import com.bbthechange.roomsync.identity.TenantRoomIdentity;
import com.bbthechange.roomsync.model.BotPermissionSnapshot;
import com.bbthechange.roomsync.model.EntityRef;
import com.bbthechange.roomsync.model.RoomHandle;
import com.bbthechange.roomsync.model.RoomRecord;
import com.bbthechange.roomsync.service.BotPermissionService;
import com.bbthechange.roomsync.service.ChatMembershipService;
import com.bbthechange.roomsync.service.RoomLifecycleManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Local chat surface for an event or group: membership sync, room lifecycle and diagnostics.
 */
@RestController
@RequestMapping("/tenants/{tenantId}/{entityType}/{slug}/chat")
@Validated
@Tag(name = "Chat rooms", description = "Chat room membership and lifecycle for events and groups")
public class ChatRoomController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(ChatRoomController.class);

    private static final String TENANT_REGEX = "[a-z0-9]+";
    private static final String ENTITY_TYPE_REGEX = "event|group";
    private static final String SLUG_REGEX = "[a-z0-9](?:[a-z0-9._-]*[a-z0-9._])?";

    private final ChatMembershipService chatMembershipService;
    private final RoomLifecycleManager roomLifecycleManager;
    private final BotPermissionService botPermissionService;
    private final TenantRoomIdentity identity;

    @Autowired
    public ChatRoomController(ChatMembershipService chatMembershipService,
                              RoomLifecycleManager roomLifecycleManager,
                              BotPermissionService botPermissionService,
                              TenantRoomIdentity identity) {
        this.chatMembershipService = chatMembershipService;
        this.roomLifecycleManager = roomLifecycleManager;
        this.botPermissionService = botPermissionService;
        this.identity = identity;
    }

    @PostMapping("/members")
    @Operation(summary = "Add a member to the chat room",
               description = "Invites the user into the entity's room, granting the requested role if allowed.")
    public ResponseEntity<MembershipSyncResponse> addMember(
            @PathVariable @Pattern(regexp = TENANT_REGEX, message = "Invalid tenant ID format") String tenantId,
            @PathVariable @Pattern(regexp = ENTITY_TYPE_REGEX, message = "Invalid entity type") String entityType,
            @PathVariable @Pattern(regexp = SLUG_REGEX, message = "Invalid slug format") String slug,
            @Valid @RequestBody AddChatMemberRequest request,
            HttpServletRequest httpRequest) {

        String actorSlug = extractActorSlug(httpRequest);
        EntityRef entity = entityRef(tenantId, entityType, slug);
        logger.info("User {} adding {} to chat of {}", actorSlug, request.getUserSlug(), entity);

        return toResponse(chatMembershipService.addMember(entity, actorSlug, request.getUserSlug(), request.getRole()));
    }

    @DeleteMapping("/members/{userSlug}")
    @Operation(summary = "Remove a member from the chat room")
    public ResponseEntity<MembershipSyncResponse> removeMember(
            @PathVariable @Pattern(regexp = TENANT_REGEX, message = "Invalid tenant ID format") String tenantId,
            @PathVariable @Pattern(regexp = ENTITY_TYPE_REGEX, message = "Invalid entity type") String entityType,
            @PathVariable @Pattern(regexp = SLUG_REGEX, message = "Invalid slug format") String slug,
            @PathVariable @Pattern(regexp = SLUG_REGEX, message = "Invalid user slug format") String userSlug,
            HttpServletRequest httpRequest) {

        String actorSlug = extractActorSlug(httpRequest);
        EntityRef entity = entityRef(tenantId, entityType, slug);
        logger.info("User {} removing {} from chat of {}", actorSlug, userSlug, entity);

        return toResponse(chatMembershipService.removeMember(entity, actorSlug, userSlug));
    }

    @PatchMapping("/members/{userSlug}/role")
    @Operation(summary = "Change a member's role")
    public ResponseEntity<MembershipSyncResponse> changeRole(
            @PathVariable @Pattern(regexp = TENANT_REGEX, message = "Invalid tenant ID format") String tenantId,
            @PathVariable @Pattern(regexp = ENTITY_TYPE_REGEX, message = "Invalid entity type") String entityType,
            @PathVariable @Pattern(regexp = SLUG_REGEX, message = "Invalid slug format") String slug,
            @PathVariable @Pattern(regexp = SLUG_REGEX, message = "Invalid user slug format") String userSlug,
            @Valid @RequestBody ChangeRoleRequest request,
            HttpServletRequest httpRequest) {

        String actorSlug = extractActorSlug(httpRequest);
        EntityRef entity = entityRef(tenantId, entityType, slug);
        logger.info("User {} changing role of {} to {} in {}", actorSlug, userSlug, request.getRole(), entity);

        return toResponse(chatMembershipService.changeRole(entity, actorSlug, userSlug, request.getRole()));
    }

    @PostMapping("/room")
    @Operation(summary = "Ensure the chat room exists",
               description = "Returns 201 when this call created the room, 200 when it already existed.")
    public ResponseEntity<RoomHandleResponse> ensureRoom(
            @PathVariable @Pattern(regexp = TENANT_REGEX, message = "Invalid tenant ID format") String tenantId,
            @PathVariable @Pattern(regexp = ENTITY_TYPE_REGEX, message = "Invalid entity type") String entityType,
            @PathVariable @Pattern(regexp = SLUG_REGEX, message = "Invalid slug format") String slug) {

        EntityRef entity = entityRef(tenantId, entityType, slug);
        RoomHandle handle = roomLifecycleManager.ensure(entity.tenantId(), entity.entityType(), entity.entitySlug());

        return ResponseEntity.status(handle.recreated() ? HttpStatus.CREATED : HttpStatus.OK)
            .body(new RoomHandleResponse(handle));
    }

    @PutMapping("/room/slug")
    @Operation(summary = "Move the chat room to a new slug",
               description = "Keeps the room and its members; the old alias stays resolvable.")
    public ResponseEntity<RoomHandleResponse> changeSlug(
            @PathVariable @Pattern(regexp = TENANT_REGEX, message = "Invalid tenant ID format") String tenantId,
            @PathVariable @Pattern(regexp = ENTITY_TYPE_REGEX, message = "Invalid entity type") String entityType,
            @PathVariable @Pattern(regexp = SLUG_REGEX, message = "Invalid slug format") String slug,
            @Valid @RequestBody ChangeSlugRequest request) {

        EntityRef entity = entityRef(tenantId, entityType, slug);
        logger.info("Moving chat room of {} to slug {}", entity, request.getNewSlug());

        RoomHandle handle = roomLifecycleManager.changeSlug(
            entity.tenantId(), entity.entityType(), entity.entitySlug(), request.getNewSlug());
        return ResponseEntity.ok(new RoomHandleResponse(handle));
    }

    @DeleteMapping("/room")
    @Operation(summary = "Retire the chat room after the entity was deleted")
    public ResponseEntity<Void> retireRoom(
            @PathVariable @Pattern(regexp = TENANT_REGEX, message = "Invalid tenant ID format") String tenantId,
            @PathVariable @Pattern(regexp = ENTITY_TYPE_REGEX, message = "Invalid entity type") String entityType,
            @PathVariable @Pattern(regexp = SLUG_REGEX, message = "Invalid slug format") String slug) {

        EntityRef entity = entityRef(tenantId, entityType, slug);
        roomLifecycleManager.retire(entity.tenantId(), entity.entityType(), entity.entitySlug());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/room/permissions")
    @Operation(summary = "Diagnose bot permissions in the chat room",
               description = "Probes invite and kick authority, elevating the bot if it lost them.")
    public ResponseEntity<BotPermissionSnapshot> diagnosePermissions(
            @Parameter(description = "Tenant ID")
            @PathVariable @Pattern(regexp = TENANT_REGEX, message = "Invalid tenant ID format") String tenantId,
            @PathVariable @Pattern(regexp = ENTITY_TYPE_REGEX, message = "Invalid entity type") String entityType,
            @PathVariable @Pattern(regexp = SLUG_REGEX, message = "Invalid slug format") String slug,
            HttpServletRequest httpRequest) {

        String actorSlug = extractActorSlug(httpRequest);
        EntityRef entity = entityRef(tenantId, entityType, slug);

        RoomRecord record = roomLifecycleManager.findRoom(entity.tenantId(), entity.entityType(), entity.entitySlug())
            .filter(room -> !room.isRetired())
            .orElseThrow(() -> RoomSyncException.notFound("No chat room for " + entity));

        BotPermissionSnapshot snapshot = botPermissionService.diagnose(
            entity.tenantId(), record.getExternalRoomId(), identity.buildUserId(entity.tenantId(), actorSlug));
        return ResponseEntity.ok(snapshot);
    }
}
