package de.t14d3.kvstore.test.entities;

import de.t14d3.kvstore.annotations.Entity;
import de.t14d3.kvstore.annotations.Id;

@Entity(storageName = "labels")
public class Label {
    @Id
    private String scope;

    @Id
    private String name;

    private String text;

    public Label() {}

    public Label(String scope, String name, String text) {
        this.scope = scope;
        this.name = name;
        this.text = text;
    }

    public String getScope() { return scope; }

    public String getName() { return name; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }
}
