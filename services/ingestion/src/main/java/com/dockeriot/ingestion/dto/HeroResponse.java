package com.dockeriot.ingestion.dto;

import com.dockeriot.ingestion.model.Hero;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeroResponse {

    private Long id;
    private String name;

    @JsonProperty("secret_name")
    private String secretName;

    private Integer age;

    public static HeroResponse fromEntity(Hero hero) {
        return HeroResponse.builder()
                .id(hero.getId())
                .name(hero.getName())
                .secretName(hero.getSecretName())
                .age(hero.getAge())
                .build();
    }
}
