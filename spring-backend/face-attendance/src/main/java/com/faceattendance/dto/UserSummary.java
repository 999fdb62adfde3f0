package com.faceattendance.dto;

import com.faceattendance.model.User;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

@Value
public class UserSummary {

    @JsonProperty("user_id")
    String userId;

    String name;

    @JsonProperty("created_at")
    Instant createdAt;

    public static UserSummary of(User user) {
        return new UserSummary(user.getUserId(), user.getName(), user.getCreatedAt());
    }
}
