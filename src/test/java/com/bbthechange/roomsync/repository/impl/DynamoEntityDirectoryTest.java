package com.bbthechange.roomsync.repository.impl;

import com.bbthechange.roomsync.exception.RepositoryException;
import com.bbthechange.roomsync.model.EntityMembership;
import com.bbthechange.roomsync.model.EntityRef;
import com.bbthechange.roomsync.model.EntityType;
import com.bbthechange.roomsync.model.MemberRole;
import com.bbthechange.roomsync.util.QueryPerformanceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DynamoEntityDirectoryTest {

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private QueryPerformanceTracker queryPerformanceTracker;

    private DynamoEntityDirectory directory;

    @BeforeEach
    void setUp() {
        lenient().when(queryPerformanceTracker.trackQuery(anyString(), anyString(), any()))
            .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(2)).get());

        directory = new DynamoEntityDirectory(dynamoDbClient, queryPerformanceTracker, "ChatRoomTable");
    }

    private static GetItemResponse itemWith(Map<String, AttributeValue> item) {
        return GetItemResponse.builder().item(item).build();
    }

    @Test
    void entityExists_RowPresent_ReturnsTrue() {
        // Given
        when(dynamoDbClient.getItem(any(GetItemRequest.class)))
            .thenReturn(itemWith(Map.of("pk", AttributeValue.builder().s("TENANT#t1").build())));

        // When
        boolean exists = directory.entityExists("t1", EntityType.GROUP, "club");

        // Then
        assertThat(exists).isTrue();
        ArgumentCaptor<GetItemRequest> captor = ArgumentCaptor.forClass(GetItemRequest.class);
        verify(dynamoDbClient).getItem(captor.capture());
        assertThat(captor.getValue().key().get("sk").s()).isEqualTo("GROUP#club");
        assertThat(captor.getValue().projectionExpression()).isEqualTo("pk");
    }

    @Test
    void entityExists_RowMissing_ReturnsFalse() {
        when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

        assertThat(directory.entityExists("t1", EntityType.EVENT, "foo")).isFalse();
    }

    @Test
    void entityExists_DynamoFailure_ThrowsRepositoryException() {
        when(dynamoDbClient.getItem(any(GetItemRequest.class)))
            .thenThrow(DynamoDbException.builder().message("unavailable").build());

        assertThatThrownBy(() -> directory.entityExists("t1", EntityType.EVENT, "foo"))
            .isInstanceOf(RepositoryException.class);
    }

    @Test
    void findMemberRole_StoredRole_Parsed() {
        when(dynamoDbClient.getItem(any(GetItemRequest.class)))
            .thenReturn(itemWith(Map.of("role", AttributeValue.builder().s("MODERATOR").build())));

        assertThat(directory.findMemberRole("t1", EntityType.EVENT, "foo", "mod")).contains(MemberRole.MODERATOR);

        ArgumentCaptor<GetItemRequest> captor = ArgumentCaptor.forClass(GetItemRequest.class);
        verify(dynamoDbClient).getItem(captor.capture());
        assertThat(captor.getValue().key().get("sk").s()).isEqualTo("EVENT#foo#MEMBER#mod");
    }

    @Test
    void findMemberRole_UnknownRole_ReturnsEmpty() {
        when(dynamoDbClient.getItem(any(GetItemRequest.class)))
            .thenReturn(itemWith(Map.of("role", AttributeValue.builder().s("superuser").build())));

        assertThat(directory.findMemberRole("t1", EntityType.EVENT, "foo", "eve")).isEmpty();
    }

    @Test
    void findMemberRole_NoMembership_ReturnsEmpty() {
        when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

        assertThat(directory.findMemberRole("t1", EntityType.EVENT, "foo", "nobody")).isEmpty();
    }

    @Test
    void recordMemberRole_WritesLowercaseRoleName() {
        when(dynamoDbClient.updateItem(any(UpdateItemRequest.class))).thenReturn(UpdateItemResponse.builder().build());

        directory.recordMemberRole("t1", EntityType.EVENT, "foo", "gus", MemberRole.MEMBER);

        ArgumentCaptor<UpdateItemRequest> captor = ArgumentCaptor.forClass(UpdateItemRequest.class);
        verify(dynamoDbClient).updateItem(captor.capture());
        UpdateItemRequest request = captor.getValue();
        assertThat(request.key().get("sk").s()).isEqualTo("EVENT#foo#MEMBER#gus");
        assertThat(request.expressionAttributeValues().get(":role").s()).isEqualTo("member");
        assertThat(request.expressionAttributeNames()).containsEntry("#role", "role");
        assertThat(request.expressionAttributeValues().get(":user").s()).isEqualTo("gus");
    }

    private static Map<String, AttributeValue> memberRow(String sk, String role) {
        return Map.of(
            "pk", AttributeValue.builder().s("TENANT#t1").build(),
            "sk", AttributeValue.builder().s(sk).build(),
            "role", AttributeValue.builder().s(role).build(),
            "userSlug", AttributeValue.builder().s("gus").build());
    }

    @Test
    void findMemberships_FollowsPagesAndParsesEntities() {
        // Given
        Map<String, AttributeValue> pageEnd = Map.of(
            "pk", AttributeValue.builder().s("TENANT#t1").build(),
            "sk", AttributeValue.builder().s("EVENT#foo#MEMBER#gus").build());
        when(dynamoDbClient.query(any(QueryRequest.class)))
            .thenReturn(QueryResponse.builder()
                .items(List.of(memberRow("EVENT#foo#MEMBER#gus", "guest")))
                .lastEvaluatedKey(pageEnd)
                .build())
            .thenReturn(QueryResponse.builder()
                .items(List.of(memberRow("GROUP#club#MEMBER#gus", "admin")))
                .build());

        // When
        List<EntityMembership> memberships = directory.findMemberships("t1", "gus");

        // Then
        assertThat(memberships).containsExactly(
            new EntityMembership(new EntityRef("t1", EntityType.EVENT, "foo"), "gus", MemberRole.GUEST),
            new EntityMembership(new EntityRef("t1", EntityType.GROUP, "club"), "gus", MemberRole.ADMIN));

        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(dynamoDbClient, times(2)).query(captor.capture());
        QueryRequest first = captor.getAllValues().get(0);
        assertThat(first.expressionAttributeValues().get(":pk").s()).isEqualTo("TENANT#t1");
        assertThat(first.expressionAttributeValues().get(":user").s()).isEqualTo("gus");
        assertThat(first.filterExpression()).contains("userSlug = :user");
        assertThat(captor.getAllValues().get(1).exclusiveStartKey()).isEqualTo(pageEnd);
    }

    @Test
    void findMemberships_UnreadableRows_Skipped() {
        when(dynamoDbClient.query(any(QueryRequest.class)))
            .thenReturn(QueryResponse.builder()
                .items(List.of(
                    memberRow("EVENT#foo#MEMBER#gus", "superuser"),
                    memberRow("ROOM#event#foo", "member"),
                    memberRow("GROUP#club#MEMBER#gus", "member")))
                .build());

        assertThat(directory.findMemberships("t1", "gus"))
            .extracting(membership -> membership.entity().entitySlug())
            .containsExactly("club");
    }

    @Test
    void findMemberships_DynamoFailure_ThrowsRepositoryException() {
        when(dynamoDbClient.query(any(QueryRequest.class)))
            .thenThrow(DynamoDbException.builder().message("unavailable").build());

        assertThatThrownBy(() -> directory.findMemberships("t1", "gus"))
            .isInstanceOf(RepositoryException.class);
    }

    @Test
    void removeMember_DeletesMembershipRow() {
        when(dynamoDbClient.deleteItem(any(DeleteItemRequest.class))).thenReturn(DeleteItemResponse.builder().build());

        directory.removeMember("t1", EntityType.GROUP, "club", "gus");

        ArgumentCaptor<DeleteItemRequest> captor = ArgumentCaptor.forClass(DeleteItemRequest.class);
        verify(dynamoDbClient).deleteItem(captor.capture());
        assertThat(captor.getValue().key().get("sk").s()).isEqualTo("GROUP#club#MEMBER#gus");
    }
}
