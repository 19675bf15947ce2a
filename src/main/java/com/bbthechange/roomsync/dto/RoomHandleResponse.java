package com.bbthechange.roomsync.dto;

import com.bbthechange.roomsync.model.RoomHandle;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class RoomHandleResponse {

    private String roomId;
    private String alias;
    private boolean recreated;

    public RoomHandleResponse(RoomHandle handle) {
        this.roomId = handle.roomId();
        this.alias = handle.alias();
        this.recreated = handle.recreated();
    }
}
