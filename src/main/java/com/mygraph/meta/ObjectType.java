package com.mygraph.meta;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class ObjectType {
    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("properties")
    private List<Property> properties;

    @JsonProperty("relationships")
    private List<LinkType> relationships;

    @JsonIgnore
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @JsonIgnore
    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    @JsonIgnore
    public List<Property> getProperties() {
        return properties;
    }

    public void setProperties(List<Property> properties) {
        this.properties = properties;
    }

    @JsonIgnore
    public List<LinkType> getRelationships() {
        return relationships;
    }

    public void setRelationships(List<LinkType> relationships) {
        this.relationships = relationships;
    }
}
