package de.t14d3.kvstore.test.entities;

import de.t14d3.kvstore.annotations.Entity;
import de.t14d3.kvstore.annotations.Id;

@Entity(storageName = "reservations")
public class Reservation {
    @Id
    private String hotel;

    @Id
    private Integer room;

    private String guest;

    public Reservation() {}

    public Reservation(String hotel, Integer room, String guest) {
        this.hotel = hotel;
        this.room = room;
        this.guest = guest;
    }

    public String getHotel() { return hotel; }

    public Integer getRoom() { return room; }

    public String getGuest() { return guest; }
    public void setGuest(String guest) { this.guest = guest; }
}
