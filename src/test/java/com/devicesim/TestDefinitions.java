package com.devicesim;

import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.io.DefinitionLoader;

import java.net.URISyntaxException;
import java.nio.file.Path;

/**
 * Loads the YAML fixtures under {@code src/test/resources/definitions}, and the lantern used by
 * branching tests under {@code src/test/resources/branching}.
 */
public final class TestDefinitions {

    private static DefinitionCatalog catalog;
    private static DefinitionCatalog branching;

    private TestDefinitions() {}

    public static Path path() {
        return resource("/definitions");
    }

    private static Path resource(String name) {
        try {
            return Path.of(TestDefinitions.class.getResource(name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Fixture directory not found", e);
        }
    }

    public static synchronized DefinitionCatalog catalog() {
        if (catalog == null) {
            catalog = new DefinitionLoader().load(path());
        }
        return catalog;
    }

    public static synchronized DefinitionCatalog branchingCatalog() {
        if (branching == null) {
            branching = new DefinitionLoader().load(resource("/branching"));
        }
        return branching;
    }
}
