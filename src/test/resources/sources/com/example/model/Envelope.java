package com.example.model;

import javax.annotation.processing.Generated;

@Generated("fixture-gen")
public class Envelope extends GeneratedMessageBase {
    public Person sender;
    public long timestamp;

    public Person getSender() {
        return sender == null ? new Person() : sender;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String describe() {
        return sender.name;
    }
}
