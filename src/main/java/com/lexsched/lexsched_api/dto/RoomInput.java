package com.lexsched.lexsched_api.dto;

public record RoomInput(String id, Integer capacity) {
}
