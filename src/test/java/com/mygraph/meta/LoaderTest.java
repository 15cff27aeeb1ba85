package com.mygraph.meta;

import static org.junit.jupiter.api.Assertions.*;

import com.mygraph.model.MappedNode;
import com.mygraph.model.NodeType;
import com.mygraph.model.SchemaRegistry;
import com.mygraph.model.ZeroOrOneRelationshipManager;
import com.mygraph.repository.ConnectionAdapter;
import com.mygraph.repository.Direction;
import com.mygraph.repository.InMemoryGraphStoreClient;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoaderTest {

    private Loader loader;
    private SchemaRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        String path = Paths.get(getClass().getResource("/schema/people.yaml").toURI()).toString();
        loader = new Loader(path);
        InMemoryGraphStoreClient client = new InMemoryGraphStoreClient();
        registry = new SchemaRegistry(new ConnectionAdapter(() -> client));
    }

    @Test
    void loadParsesNodeTypes() throws Exception {
        loader.load();

        assertEquals("1.0", loader.getSchema().getVersion());
        assertEquals("people", loader.getSchema().getNamespace());
        assertEquals(2, loader.listObjectTypes().size());

        ObjectType pet = loader.getObjectType("Pet");
        assertEquals(2, pet.getProperties().size());
        LinkType owner = pet.getRelationships().get(0);
        assertEquals("incoming", owner.getDirection());
        assertEquals("zero_or_one", owner.getCardinality());

        LinkType friends = loader.getObjectType("Person").getRelationships().get(0);
        assertEquals("outgoing", friends.getDirection());
        assertEquals("many", friends.getCardinality());
    }

    @Test
    void unknownObjectTypeIsReported() throws Exception {
        loader.load();

        assertThrows(Loader.NotFoundException.class, () -> loader.getObjectType("Car"));
    }

    @Test
    void missingFileFailsToLoad() {
        Loader missing = new Loader("does/not/exist.yaml");

        IOException e = assertThrows(IOException.class, missing::load);
        assertTrue(e.getMessage().contains("schema file not found"));
        assertTrue(missing.listObjectTypes().isEmpty());
    }

    @Test
    void registerAllBuildsNodeTypes() throws Exception {
        loader.load();

        List<NodeType> types = loader.registerAll(registry);

        assertEquals(2, types.size());
        NodeType person = registry.getType("Person");
        assertTrue(person.getProperty("name").isUniqueIndex());
        assertTrue(person.getProperty("age").isIndexed());
        assertTrue(person.getProperty("bio").isBlank());
        assertEquals(Direction.EITHER, person.getRelationships().get("spouse").getDirection());
        assertEquals("MARRIED_TO", person.getRelationships().get("spouse").getRelationType());
        assertEquals(Direction.INCOMING, registry.getType("Pet").getRelationships().get("owner").getDirection());
    }

    @Test
    void registeredTypesWorkEndToEnd() throws Exception {
        loader.load();
        loader.registerAll(registry);
        NodeType person = registry.getType("Person");

        MappedNode jim = person.create(Map.of("name", "Jim", "age", 30)).save();
        MappedNode ann = person.create(Map.of("name", "Ann", "age", 29)).save();
        ZeroOrOneRelationshipManager spouse = jim.related("spouse", ZeroOrOneRelationshipManager.class);
        spouse.relate(ann);

        MappedNode reloaded = person.getIndex().get("name", "Ann");
        MappedNode found = reloaded.related("spouse", ZeroOrOneRelationshipManager.class).single().orElseThrow();
        assertEquals(jim.getId(), found.getId());
    }

    @Test
    void relationshipsMayReferencePreviouslyRegisteredTypes() throws Exception {
        Loader petsOnly = new Loader(Paths.get(getClass().getResource("/schema/pets.yaml").toURI()).toString());

        assertThrows(Validator.ValidationException.class, petsOnly::load);

        petsOnly.load(Set.of("Person"));
        assertEquals(1, petsOnly.listObjectTypes().size());
    }
}
