package com.designgrowth.backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateNotificationRequest {
    @NotBlank(message = "User id is required.")
    private String userId;

    @NotBlank(message = "Kind is required.")
    private String kind;

    @NotBlank(message = "Message is required.")
    private String message;

    private List<String> sentVia;
}
