package com.example.model;

public class PlainPojo {
    public String name;

    public String getName() {
        return name;
    }
}
