// Code generated by fixture-gen. DO NOT EDIT.
// source: person.schema

package com.example.model;

import java.util.Collections;
import java.util.List;

public class Person {
    public String name;
    public int age;
    public boolean active;
    public Address address;
    public List<String> tags;
    public String nickname;

    public String getName() {
        return name == null ? "" : name;
    }

    public int getAge() {
        return age;
    }

    public boolean getActive() {
        return active;
    }

    public Address getAddress() {
        return address == null ? Address.getDefaultInstance() : address;
    }

    public List<String> getTags() {
        return tags == null ? Collections.emptyList() : tags;
    }

    public Object getDescriptorForType() {
        return null;
    }
}
