package de.t14d3.kvstore.test.entities;

import de.t14d3.kvstore.annotations.Entity;
import de.t14d3.kvstore.annotations.Id;
import de.t14d3.kvstore.annotations.Transient;
import de.t14d3.kvstore.mapping.ExtraAttributes;

import java.util.LinkedHashMap;
import java.util.Map;

@Entity(storageName = "documents")
public class Document implements ExtraAttributes {
    @Id
    private Long id;

    private String title;

    @Transient
    private final Map<String, Object> extra = new LinkedHashMap<>();

    public Document() {}

    public Document(Long id, String title) {
        this.id = id;
        this.title = title;
    }

    public Long getId() { return id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    @Override
    public Map<String, Object> getExtraAttributes() {
        return extra;
    }
}
