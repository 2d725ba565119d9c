package com.flagship.savings_circle.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.util.UUID;

@Value
public class AddMemberRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be a valid email address")
    @JsonProperty("email")
    String email;

    @JsonProperty("user_id")
    UUID userId;
}
