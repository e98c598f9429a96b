package com.recnos.ratetelemetry.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class EventDto {

    @JsonProperty("username")
    private String username = "";

    @JsonProperty("age")
    private int age;

    public EventDto() {
    }

    public EventDto(String username, int age) {
        this.username = username;
        this.age = age;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public int getAge() {
        return age;
    }

    public void setAge(int age) {
        this.age = age;
    }

    @Override
    public String toString() {
        return "EventDto{username='" + username + "', age=" + age + "}";
    }
}
