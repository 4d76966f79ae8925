package com.dockeriot.ingestion.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeroRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @NotBlank(message = "Secret name is required")
    @JsonProperty("secret_name")
    private String secretName;

    @PositiveOrZero(message = "Age cannot be negative")
    private Integer age;
}
