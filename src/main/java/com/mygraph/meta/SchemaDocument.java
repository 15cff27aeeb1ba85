package com.mygraph.meta;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class SchemaDocument {
    @JsonProperty("version")
    private String version;

    @JsonProperty("namespace")
    private String namespace;

    @JsonProperty("node_types")
    private List<ObjectType> nodeTypes;

    @JsonIgnore
    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    @JsonIgnore
    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    @JsonIgnore
    public List<ObjectType> getNodeTypes() {
        return nodeTypes;
    }

    public void setNodeTypes(List<ObjectType> nodeTypes) {
        this.nodeTypes = nodeTypes;
    }
}
