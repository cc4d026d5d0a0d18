package com.scenetree.hierarchy.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.scenetree.common.IEnvGetter;
import com.scenetree.common.errorsor.ErrorsOr;
import com.scenetree.hierarchy.HierarchySearch;
import com.scenetree.hierarchy.SearchOrder;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds a {@link HierarchySearchConfig} from JSON or the environment. Never throws: problems come back as errors.
 * <p>
 * JSON shape (every field optional): {@code {"pathSeparator":"/","defaultOrder":"BREADTH_FIRST","ancestorMustBeActive":true}}.
 * Unknown fields are rejected.
 */
public interface HierarchySearchConfigLoader {

    String ENV_PATH_SEPARATOR = "HIERARCHY_PATH_SEPARATOR";
    String ENV_DEFAULT_ORDER = "HIERARCHY_DEFAULT_ORDER";
    String ENV_ANCESTOR_MUST_BE_ACTIVE = "HIERARCHY_ANCESTOR_MUST_BE_ACTIVE";

    ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    ObjectReader CONFIG_READER = JSON.readerFor(HierarchySearchConfig.class);

    // -------- Parse from JSON --------

    static ErrorsOr<HierarchySearchConfig> fromJson(InputStream in) {
        return ErrorsOr.trying("Failed to parse HierarchySearchConfig: {0}: {1}", () -> CONFIG_READER.<HierarchySearchConfig>readValue(in));
    }

    static ErrorsOr<HierarchySearchConfig> fromJson(String json) {
        try (InputStream in = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))) {
            return fromJson(in);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to read HierarchySearchConfig JSON: {0}: {1}", e);
        }
    }

    // -------- Load from classpath --------

    static ErrorsOr<HierarchySearchConfig> fromClasspath(String resourcePath) {
        return fromClasspath(resourcePath, Thread.currentThread().getContextClassLoader());
    }

    /** Falls back to this interface's class loader when {@code cl} is null or lacks the resource. */
    static ErrorsOr<HierarchySearchConfig> fromClasspath(String resourcePath, ClassLoader cl) {
        try {
            InputStream in = (cl == null) ? null : cl.getResourceAsStream(resourcePath);
            if (in == null) {
                ClassLoader fallback = HierarchySearchConfigLoader.class.getClassLoader();
                in = (fallback == null) ? null : fallback.getResourceAsStream(resourcePath);
            }
            if (in == null) {
                return ErrorsOr.error("Classpath resource not found: " + resourcePath);
            }
            try (InputStream autoClose = in) {
                return fromJson(autoClose).addPrefixIfError("hierarchy config '" + resourcePath + "': ");
            }
        } catch (Exception e) {
            return ErrorsOr.error("Failed to load HierarchySearchConfig from classpath '" + resourcePath + "': "
                    + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    // -------- Environment --------

    /** Unset variables keep their defaults; every bad value is reported, not just the first. */
    static ErrorsOr<HierarchySearchConfig> fromEnv(IEnvGetter env) {
        List<String> errors = new ArrayList<>();

        String separator = IEnvGetter.getStringOr(env, ENV_PATH_SEPARATOR, HierarchySearch.DEFAULT_SEPARATOR);

        SearchOrder order = SearchOrder.DEPTH_FIRST;
        String orderText = IEnvGetter.getTrimmedOrNull(env, ENV_DEFAULT_ORDER);
        if (orderText != null) {
            Optional<SearchOrder> parsed = SearchOrder.parse(orderText);
            if (parsed.isPresent()) order = parsed.get();
            else errors.add("Invalid " + ENV_DEFAULT_ORDER + " = '" + orderText + "' (expected DEPTH_FIRST or BREADTH_FIRST)");
        }

        String activeText = IEnvGetter.getTrimmedOrNull(env, ENV_ANCESTOR_MUST_BE_ACTIVE);
        if (activeText != null && !activeText.equalsIgnoreCase("true") && !activeText.equalsIgnoreCase("false")) {
            errors.add("Invalid " + ENV_ANCESTOR_MUST_BE_ACTIVE + " = '" + activeText + "' (expected true or false)");
        }
        boolean ancestorMustBeActive = IEnvGetter.getBooleanOr(env, ENV_ANCESTOR_MUST_BE_ACTIVE, false);

        if (!errors.isEmpty()) return ErrorsOr.errors(errors);
        return ErrorsOr.lift(new HierarchySearchConfig(separator, order, ancestorMustBeActive));
    }
}
