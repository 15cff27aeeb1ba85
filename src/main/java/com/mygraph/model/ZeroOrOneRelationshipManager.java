package com.mygraph.model;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * 最多关联一个节点的关系
 */
public class ZeroOrOneRelationshipManager extends RelationshipManager {

    public ZeroOrOneRelationshipManager(MappedNode origin, String name, RelationshipDefinition definition) {
        super(origin, name, definition);
    }

    public Optional<MappedNode> single() throws IOException, OgmException {
        List<MappedNode> nodes = all();
        if (nodes.size() > 1) {
            throw new CardinalityViolationException(origin.getTypeName() + "." + name
                + " expects at most one related node but found " + nodes.size());
        }
        return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(0));
    }

    @Override
    public void relate(MappedNode obj) throws IOException, OgmException {
        checkTarget(obj);
        Optional<MappedNode> current = single();
        if (current.isPresent() && !obj.getId().equals(current.get().getId())) {
            throw new CardinalityViolationException(origin.getTypeName() + "." + name
                + " is already related to " + current.get().getId());
        }
        super.relate(obj);
    }
}
