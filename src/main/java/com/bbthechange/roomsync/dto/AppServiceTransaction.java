package com.bbthechange.roomsync.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Batch of events pushed by the homeserver to the application service.
 */
@Data
public class AppServiceTransaction {

    private List<Map<String, Object>> events = new ArrayList<>();
}
