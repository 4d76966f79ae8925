package com.dockeriot.ingestion.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "hero", indexes = {
    @Index(name = "ix_hero_name", columnList = "name"),
    @Index(name = "ix_hero_age", columnList = "age")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Hero {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "secret_name", nullable = false)
    private String secretName;

    private Integer age;
}
