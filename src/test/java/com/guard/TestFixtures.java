package com.guard;

import com.guard.model.ApiOperation;
import com.guard.model.ApiParameter;
import com.guard.model.ApiSpecification;
import com.guard.model.EndpointKey;
import com.guard.model.SemanticVersion;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared helpers for locating classpath fixtures and building small spec models by hand.
 */
public final class TestFixtures {

    private TestFixtures() {
    }

    /**
     * Resolves a test resource to a clean, OS-agnostic file path.
     */
    public static Path resource(String name) {
        URL resource = TestFixtures.class.getClassLoader().getResource(name);
        if (resource == null) {
            throw new IllegalArgumentException("Missing test resource: " + name);
        }
        try {
            return Paths.get(resource.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Bad test resource URI: " + resource, e);
        }
    }

    public static ApiSpecification spec(String source, String version, ApiOperation... operations) {
        Map<EndpointKey, ApiOperation> byKey = new LinkedHashMap<>();
        for (ApiOperation operation : operations) {
            byKey.put(operation.key(), operation);
        }
        return new ApiSpecification(source, version, SemanticVersion.parse(version), byKey);
    }

    public static ApiOperation operation(String method, String path, List<ApiParameter> parameters, String... responses) {
        Map<String, ApiParameter> byName = new LinkedHashMap<>();
        parameters.forEach(p -> byName.put(p.name(), p));
        return new ApiOperation(path, method, byName, Set.copyOf(Arrays.asList(responses)));
    }

    public static ApiOperation operation(String method, String path, String... responses) {
        return operation(method, path, List.of(), responses);
    }
}
