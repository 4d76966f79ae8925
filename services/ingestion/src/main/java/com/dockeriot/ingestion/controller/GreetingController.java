package com.dockeriot.ingestion.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class GreetingController {

    static final String GREETING = "Hello, Docker-iot-World!";

    @GetMapping("/")
    public String hello() {
        return GREETING;
    }
}
