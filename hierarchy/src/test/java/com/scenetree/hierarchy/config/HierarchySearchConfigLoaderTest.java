package com.scenetree.hierarchy.config;

import com.scenetree.common.IEnvGetter;
import com.scenetree.hierarchy.SearchOrder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.scenetree.hierarchy.config.HierarchySearchConfigLoader.*;
import static org.junit.jupiter.api.Assertions.*;

class HierarchySearchConfigLoaderTest {

    private static IEnvGetter env(Map<String, String> kv) {
        Map<String, String> copy = new HashMap<>(kv);
        return copy::get;
    }

    @Nested
    @DisplayName("fromJson / fromClasspath")
    class Json {
        @Test
        void readsAllFields() {
            var cfg = fromClasspath("config/breadth-first.json").valueOrThrow();
            assertEquals(new HierarchySearchConfig("::", SearchOrder.BREADTH_FIRST, true), cfg);
        }

        @Test
        void emptyObject_givesDefaults() {
            assertEquals(HierarchySearchConfig.defaults(), fromClasspath("config/empty.json").valueOrThrow());
            assertEquals(HierarchySearchConfig.defaults(), fromJson("{}").valueOrThrow());
        }

        @Test
        void unknownField_isAnError_prefixedWithResource() {
            List<String> errs = fromClasspath("config/unknown-field.json").errorsOrThrow();
            String msg = String.join("\n", errs);
            assertTrue(msg.startsWith("hierarchy config 'config/unknown-field.json': "), msg);
            assertTrue(msg.contains("searchDepth"), msg);
        }

        @Test
        void emptySeparator_isAnError() {
            String msg = String.join("\n", fromClasspath("config/empty-separator.json").errorsOrThrow());
            assertTrue(msg.contains("pathSeparator must not be empty"), msg);
        }

        @Test
        void unknownOrder_isAnError() {
            String msg = String.join("\n", fromJson("{\"defaultOrder\":\"SIDEWAYS\"}").errorsOrThrow());
            assertTrue(msg.contains("SIDEWAYS"), msg);
        }

        @Test
        void malformedJson_isAnError() {
            assertTrue(fromJson("{ not json").isError());
        }

        @Test
        void missingResource_isAnError() {
            assertEquals(List.of("Classpath resource not found: config/nope.json"),
                    fromClasspath("config/nope.json").errorsOrThrow());
        }

        @Test
        void nullClassLoader_fallsBackToOwnLoader() {
            assertTrue(fromClasspath("config/empty.json", null).isValue());
        }
    }

    @Nested
    @DisplayName("fromEnv")
    class Env {
        @Test
        void unset_givesDefaults() {
            assertEquals(HierarchySearchConfig.defaults(), fromEnv(env(Map.of())).valueOrThrow());
        }

        @Test
        void readsAllVariables() {
            var cfg = fromEnv(env(Map.of(
                    ENV_PATH_SEPARATOR, ".",
                    ENV_DEFAULT_ORDER, "breadth-first",
                    ENV_ANCESTOR_MUST_BE_ACTIVE, "TRUE"))).valueOrThrow();
            assertEquals(new HierarchySearchConfig(".", SearchOrder.BREADTH_FIRST, true), cfg);
        }

        @Test
        void reportsEveryBadValue() {
            List<String> errs = fromEnv(env(Map.of(
                    ENV_DEFAULT_ORDER, "sideways",
                    ENV_ANCESTOR_MUST_BE_ACTIVE, "maybe"))).errorsOrThrow();
            assertEquals(2, errs.size(), errs.toString());
            assertTrue(errs.get(0).contains(ENV_DEFAULT_ORDER), errs.get(0));
            assertTrue(errs.get(1).contains(ENV_ANCESTOR_MUST_BE_ACTIVE), errs.get(1));
        }
    }
}
