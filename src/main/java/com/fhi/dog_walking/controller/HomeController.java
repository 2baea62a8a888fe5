package com.fhi.dog_walking.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HomeController 
{
    static final String GREETING = "Hello from App Root /";

    @GetMapping("/")
    public String hello() {
        return GREETING;
    }
}
