package com.guard.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.guard.exception.ApiGuardException;
import com.guard.exception.InvalidSpecException;
import com.guard.model.ApiOperation;
import com.guard.model.ApiParameter;
import com.guard.model.ApiSpecification;
import com.guard.model.EndpointKey;
import com.guard.model.ParameterType;
import com.guard.model.SemanticVersion;
import com.guard.service.api.SpecLoader;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class SpecLoaderImpl implements SpecLoader {

    private static final String PARAMETER_REF_PREFIX = "#/components/parameters/";
    private static final String SCHEMA_REF_PREFIX = "#/components/schemas/";

    // swagger-parser keeps the last of two equal keys, so repeated keys are caught before it runs.
    // YAML is a superset of JSON, so this covers both document formats.
    private final ObjectMapper strictMapper = YAMLMapper.builder()
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .build();

    /**
     * {@inheritDoc}
     * This implementation hands the file contents to swagger-parser and then walks every path
     * and operation, converting them into the internal {@link ApiSpecification} model. Only the
     * parts the compatibility rules look at are kept: parameter names, locations, required flags
     * and types, and the declared response status codes.
     */
    @Override
    public ApiSpecification load(Path source) {
        log.info("Loading API document from: {}", source);
        OpenAPI openAPI = parse(source);

        if (openAPI.getInfo() == null || openAPI.getInfo().getVersion() == null
                || openAPI.getInfo().getVersion().isBlank()) {
            throw new InvalidSpecException("API document " + source + " does not declare info.version");
        }
        String version = openAPI.getInfo().getVersion();
        SemanticVersion semanticVersion = SemanticVersion.parse(version);

        Map<EndpointKey, ApiOperation> operations = new TreeMap<>();
        if (openAPI.getPaths() != null) {
            openAPI.getPaths().forEach((path, pathItem) -> {
                if (pathItem == null) {
                    throw new InvalidSpecException("Path '" + path + "' in " + source + " has no operations object");
                }
                pathItem.readOperationsMap().forEach((method, operation) -> {
                    ApiOperation apiOp = createApiOperation(method, operation, path, pathItem, openAPI, source);
                    if (operations.putIfAbsent(apiOp.key(), apiOp) != null) {
                        throw new InvalidSpecException("Duplicate operation " + apiOp.key() + " in " + source);
                    }
                });
            });
        }

        log.info("Parsed {} operations from {} (version {}).", operations.size(), source, version);
        return new ApiSpecification(source.toString(), version, semanticVersion, operations);
    }

    private OpenAPI parse(Path source) {
        String contents;
        try {
            contents = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ApiGuardException("Cannot read API document " + source + ": " + e.getMessage(), e);
        }

        rejectDuplicateKeys(contents, source);

        ParseOptions options = new ParseOptions();
        options.setResolve(true);
        SwaggerParseResult result;
        try {
            result = new OpenAPIV3Parser().readContents(contents, null, options);
        } catch (RuntimeException e) {
            throw new InvalidSpecException("Failed to parse API document " + source + ": " + e.getMessage(), e);
        }

        if (result == null || result.getOpenAPI() == null) {
            List<String> messages = result == null || result.getMessages() == null
                    ? Collections.emptyList() : result.getMessages();
            throw new InvalidSpecException("Failed to parse API document " + source
                    + (messages.isEmpty() ? "" : ": " + String.join("; ", messages)));
        }
        if (result.getMessages() != null && !result.getMessages().isEmpty()) {
            log.debug("Parser reported {} message(s) for {}: {}", result.getMessages().size(), source, result.getMessages());
        }
        return result.getOpenAPI();
    }

    private void rejectDuplicateKeys(String contents, Path source) {
        try {
            strictMapper.readTree(contents);
        } catch (JsonProcessingException e) {
            throw new InvalidSpecException("Malformed API document " + source + ": " + e.getOriginalMessage(), e);
        }
    }

    private ApiOperation createApiOperation(PathItem.HttpMethod method, Operation operation, String path,
                                            PathItem pathItem, OpenAPI openAPI, Path source) {
        // Path-level parameters apply to every operation; operation-level ones override them
        // when name and location match.
        Map<String, Parameter> declared = new LinkedHashMap<>();
        if (pathItem.getParameters() != null) {
            for (Parameter parameter : pathItem.getParameters()) {
                Parameter resolved = resolveParameter(parameter, openAPI);
                declared.put(resolved.getIn() + ":" + resolved.getName(), resolved);
            }
        }
        Set<String> operationLevel = new HashSet<>();
        if (operation.getParameters() != null) {
            for (Parameter parameter : operation.getParameters()) {
                Parameter resolved = resolveParameter(parameter, openAPI);
                String key = resolved.getIn() + ":" + resolved.getName();
                if (!operationLevel.add(key)) {
                    throw new InvalidSpecException("Parameter '" + resolved.getName() + "' is declared twice on "
                            + method + " " + path + " in " + source);
                }
                declared.put(key, resolved);
            }
        }

        Map<String, ApiParameter> parameters = new LinkedHashMap<>();
        for (Parameter parameter : declared.values()) {
            ApiParameter apiParam = createApiParameter(parameter, openAPI, method, path, source);
            if (parameters.putIfAbsent(apiParam.name(), apiParam) != null) {
                throw new InvalidSpecException("Parameter name '" + apiParam.name() + "' is not unique on "
                        + method + " " + path + " in " + source);
            }
        }

        Set<String> responses = operation.getResponses() == null
                ? Collections.emptySet()
                : operation.getResponses().keySet();

        return new ApiOperation(path, method.name(), parameters, responses);
    }

    private ApiParameter createApiParameter(Parameter parameter, OpenAPI openAPI, PathItem.HttpMethod method,
                                            String path, Path source) {
        if (parameter.getName() == null || parameter.getName().isBlank()) {
            throw new InvalidSpecException("A parameter of " + method + " " + path + " in " + source + " has no name");
        }
        ParameterType type;
        try {
            type = ParameterType.fromTag(schemaType(parameter.getSchema(), openAPI));
        } catch (InvalidSpecException e) {
            throw new InvalidSpecException("Parameter '" + parameter.getName() + "' of " + method + " " + path
                    + " in " + source + ": " + e.getMessage(), e);
        }
        boolean required = Boolean.TRUE.equals(parameter.getRequired());
        return new ApiParameter(parameter.getName(), parameter.getIn(), required, type);
    }

    /**
     * Returns the referenced component when the parameter is a local {@code $ref} that the parser
     * left unresolved, otherwise the parameter itself.
     */
    private Parameter resolveParameter(Parameter parameter, OpenAPI openAPI) {
        String ref = parameter.get$ref();
        if (ref != null && ref.startsWith(PARAMETER_REF_PREFIX)
                && openAPI.getComponents() != null && openAPI.getComponents().getParameters() != null) {
            Parameter resolved = openAPI.getComponents().getParameters().get(ref.substring(PARAMETER_REF_PREFIX.length()));
            if (resolved != null) {
                return resolved;
            }
        }
        return parameter;
    }

    /**
     * Reads the type tag of a parameter schema, following a local schema {@code $ref} if needed.
     * OpenAPI 3.1 documents carry the type in {@code types}; only a single declared type is used.
     */
    private String schemaType(Schema<?> schema, OpenAPI openAPI) {
        if (schema == null) {
            return null;
        }
        if (schema.get$ref() != null) {
            String ref = schema.get$ref();
            if (ref.startsWith(SCHEMA_REF_PREFIX) && openAPI.getComponents() != null
                    && openAPI.getComponents().getSchemas() != null) {
                Schema<?> resolvedSchema = openAPI.getComponents().getSchemas().get(ref.substring(SCHEMA_REF_PREFIX.length()));
                if (resolvedSchema != null && resolvedSchema != schema) {
                    return schemaType(resolvedSchema, openAPI);
                }
            }
            return null;
        }
        if (schema.getType() != null) {
            return schema.getType();
        }
        if (schema.getTypes() != null) {
            List<String> nonNull = schema.getTypes().stream().filter(t -> !"null".equals(t)).sorted().toList();
            if (nonNull.size() == 1) {
                return nonNull.get(0);
            }
        }
        return null;
    }
}
