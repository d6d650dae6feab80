package de.t14d3.kvstore.test.entities;

import de.t14d3.kvstore.annotations.Entity;
import de.t14d3.kvstore.annotations.Id;

import java.time.Instant;
import java.time.LocalDate;

@Entity(storageName = "appointments")
public class Appointment {
    @Id
    private Long id;

    private LocalDate day;

    private Instant createdAt;

    public Appointment() {}

    public Appointment(Long id, LocalDate day, Instant createdAt) {
        this.id = id;
        this.day = day;
        this.createdAt = createdAt;
    }

    public Long getId() { return id; }

    public LocalDate getDay() { return day; }
    public void setDay(LocalDate day) { this.day = day; }

    public Instant getCreatedAt() { return createdAt; }
}
