package de.t14d3.kvstore.test.entities;

import de.t14d3.kvstore.annotations.Embedded;
import de.t14d3.kvstore.annotations.Entity;
import de.t14d3.kvstore.annotations.Id;
import de.t14d3.kvstore.annotations.Transient;

import java.util.ArrayList;
import java.util.List;

@Entity(storageName = "customers")
public class Customer {
    @Id
    private String id;

    private String name;

    @Embedded
    private Address address;

    private List<String> tags = new ArrayList<>();

    @Transient
    private String sessionToken;

    public Customer() {}

    public Customer(String id, String name, Address address) {
        this.id = id;
        this.name = name;
        this.address = address;
    }

    public String getId() { return id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Address getAddress() { return address; }
    public void setAddress(Address address) { this.address = address; }

    public List<String> getTags() { return tags; }

    public String getSessionToken() { return sessionToken; }
    public void setSessionToken(String sessionToken) { this.sessionToken = sessionToken; }
}
