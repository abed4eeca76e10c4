package com.lexsched.lexsched_api.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Room {
    String id;
    int capacity;
}
