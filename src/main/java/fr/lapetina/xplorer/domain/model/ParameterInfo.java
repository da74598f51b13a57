package fr.lapetina.xplorer.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Describes a query parameter accepted by an endpoint.
 * Only used for API discovery; requests are never validated against it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterInfo(
        String name,
        String description,
        boolean required,
        String defaultValue,
        List<String> examples
) {
    public ParameterInfo {
        Objects.requireNonNull(name, "Name is required");
        description = description != null ? description : "";
        examples = examples != null ? List.copyOf(examples) : List.of();
    }

    public static ParameterInfo required(String name, String description) {
        return new ParameterInfo(name, description, true, null, null);
    }

    public static ParameterInfo optional(String name, String description) {
        return new ParameterInfo(name, description, false, null, null);
    }

    public static ParameterInfo optional(String name, String description,
                                         String defaultValue, String... examples) {
        return new ParameterInfo(name, description, false, defaultValue, List.of(examples));
    }
}
