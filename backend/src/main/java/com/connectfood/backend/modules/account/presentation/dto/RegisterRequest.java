package com.connectfood.backend.modules.account.presentation.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "name is required")
        @Size(max = 120, message = "name must be at most 120 characters")
        String name,
        @NotBlank(message = "email is required")
        @Email(message = "email must be a valid address")
        String email,
        @NotBlank(message = "password is required")
        @Size(min = 4, max = 72, message = "password must be 4-72 characters")
        String password,
        @NotBlank(message = "role is required")
        @Pattern(regexp = "(?i)donor|recipient", message = "role must be donor or recipient")
        String role,
        @DecimalMin(value = "-90.0", message = "lat must be >= -90")
        @DecimalMax(value = "90.0", message = "lat must be <= 90")
        Double lat,
        @DecimalMin(value = "-180.0", message = "lng must be >= -180")
        @DecimalMax(value = "180.0", message = "lng must be <= 180")
        Double lng,
        @Size(max = 32, message = "phone must be at most 32 characters")
        String phone,
        @Size(max = 60, message = "preferredCategory must be at most 60 characters")
        String preferredCategory
) {
}
