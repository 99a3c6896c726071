package net.hollowcube.flags;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import net.hollowcube.flags.FlagDefinitions.Flag;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureFlagEvaluatorTest {

    @Test
    void experienceContinuityIsLeftToTheCaller() throws Exception {
        // Only top level lookups go remote for these, dependents may still use the local value
        var raw = "{\"id\":107924,\"team_id\":72878,\"name\":\"\",\"key\":\"payload-test\",\"filters\":{\"groups\":[{\"variant\":null,\"properties\":[],\"rollout_percentage\":100}],\"payloads\":{},\"multivariate\":null},\"deleted\":false,\"active\":true,\"ensure_experience_continuity\":true}";
        assertEquals(FlagValue.TRUE, evalFlag(raw, "person-a", null));
    }

    @Test
    void inactiveFlagAlwaysDisabled() throws Exception {
        var raw = "{\"id\":107924,\"team_id\":72878,\"name\":\"\",\"key\":\"payload-test\",\"filters\":{\"groups\":[{\"variant\":null,\"properties\":[],\"rollout_percentage\":100}],\"payloads\":{},\"multivariate\":null},\"deleted\":false,\"active\":false,\"ensure_experience_continuity\":false}";
        assertEquals(FlagValue.FALSE, evalFlag(raw, "person-a", null));
    }

    @Test
    void noConditionsFullRollout() throws Exception {
        var raw = "{\"id\":107924,\"team_id\":72878,\"name\":\"\",\"key\":\"payload-test\",\"filters\":{\"groups\":[{\"variant\":null,\"properties\":[],\"rollout_percentage\":100}],\"payloads\":{},\"multivariate\":null},\"deleted\":false,\"active\":true,\"ensure_experience_continuity\":false}";
        assertEquals(FlagValue.TRUE, evalFlag(raw, "person-a", null));
    }

    @Test
    void noConditionGroupsDisabled() throws Exception {
        var raw = "{\"id\":1,\"key\":\"empty\",\"filters\":{\"groups\":[]},\"active\":true}";
        assertEquals(FlagValue.FALSE, evalFlag(raw, "person-a", null));
    }

    @Test
    void noConditionsWithPayload() throws Exception {
        var raw = "{\"id\":107924,\"team_id\":72878,\"name\":\"\",\"key\":\"payload-test\",\"filters\":{\"groups\":[{\"variant\":null,\"properties\":[],\"rollout_percentage\":100}],\"payloads\":{\"true\":\"{\\\"i am\\\": \\\"a payload yay!\\\"}\"},\"multivariate\":null},\"deleted\":false,\"active\":true,\"ensure_experience_continuity\":false}";
        var flag = GSON.fromJson(raw, Flag.class);
        var state = FeatureFlagEvaluator.stateFor(flag, evalFlag(raw, "person-a", null));
        assertTrue(state.isEnabled());
        assertEquals("{\"i am\": \"a payload yay!\"}", state.getPayload());
    }

    @Test
    void multiVariate() throws Exception {
        var raw = "{\"id\":107923,\"team_id\":72878,\"name\":\"\",\"key\":\"multivariant-test\",\"filters\":{\"groups\":[{\"variant\":null,\"properties\":[],\"rollout_percentage\":100}],\"payloads\":{\"variant-a\":\"{\\\"a\\\": \\\"has_a_payload\\\"}\"},\"multivariate\":{\"variants\":[{\"key\":\"variant-a\",\"name\":\"\",\"rollout_percentage\":50},{\"key\":\"variant-b\",\"name\":\"\",\"rollout_percentage\":50}]}},\"deleted\":false,\"active\":true,\"ensure_experience_continuity\":false}";
        var flag = GSON.fromJson(raw, Flag.class);

        var resultA = FeatureFlagEvaluator.stateFor(flag, evalFlag(raw, "variant-a-user-r", null)); // (-r is arbitrary to get hashed into variant a)
        assertTrue(resultA.isEnabled());
        assertEquals("variant-a", resultA.getVariant());
        assertEquals("{\"a\": \"has_a_payload\"}", resultA.getPayload());

        var resultB = FeatureFlagEvaluator.stateFor(flag, evalFlag(raw, "variant-b-user-b", null)); // (-b is arbitrary to get hashed into variant b)
        assertTrue(resultB.isEnabled());
        assertEquals("variant-b", resultB.getVariant());
        assertNull(resultB.getPayload());
    }

    @Test
    void variantOverride() throws Exception {
        var raw = "{\"id\":1,\"key\":\"multivariant-test\",\"active\":true,\"filters\":{\"groups\":[{\"properties\":[],\"rollout_percentage\":100,\"variant\":\"variant-b\"}],\"multivariate\":{\"variants\":[{\"key\":\"variant-a\",\"rollout_percentage\":50},{\"key\":\"variant-b\",\"rollout_percentage\":50}]}}}";
        assertEquals(FlagValue.variant("variant-b"), evalFlag(raw, "variant-a-user-r", null));
    }

    @Test
    void undeclaredVariantOverrideIgnored() throws Exception {
        var raw = "{\"id\":1,\"key\":\"multivariant-test\",\"active\":true,\"filters\":{\"groups\":[{\"properties\":[],\"rollout_percentage\":100,\"variant\":\"variant-z\"}],\"multivariate\":{\"variants\":[{\"key\":\"variant-a\",\"rollout_percentage\":50},{\"key\":\"variant-b\",\"rollout_percentage\":50}]}}}";
        assertEquals(FlagValue.variant("variant-a"), evalFlag(raw, "variant-a-user-r", null));
    }

    @Test
    void partialRollout() throws Exception {
        // hash("simple-flag", "some-distinct-id") is ~0.4778
        var excluded = "{\"id\":1,\"key\":\"simple-flag\",\"active\":true,\"filters\":{\"groups\":[{\"properties\":[],\"rollout_percentage\":47}]}}";
        var included = "{\"id\":1,\"key\":\"simple-flag\",\"active\":true,\"filters\":{\"groups\":[{\"properties\":[],\"rollout_percentage\":48}]}}";
        assertEquals(FlagValue.FALSE, evalFlag(excluded, "some-distinct-id", null));
        assertEquals(FlagValue.TRUE, evalFlag(included, "some-distinct-id", null));
    }

    @Test
    void raisingRolloutNeverDropsUsers() throws Exception {
        var previouslyIncluded = new HashSet<String>();
        for (int percentage = 0; percentage <= 100; percentage += 5) {
            var raw = "{\"id\":1,\"key\":\"gradual\",\"active\":true,\"filters\":{\"groups\":[{\"properties\":[],\"rollout_percentage\":" + percentage + "}]}}";
            var included = new HashSet<String>();
            for (int i = 0; i < 500; i++) {
                var distinctId = "user-" + i;
                if (evalFlag(raw, distinctId, null).isEnabled()) included.add(distinctId);
            }

            assertTrue(included.containsAll(previouslyIncluded), "users dropped when raising rollout to " + percentage);
            previouslyIncluded = included;
        }
        assertEquals(500, previouslyIncluded.size());
    }

    @Test
    void missingRolloutMeansEveryone() throws Exception {
        var raw = "{\"id\":1,\"key\":\"simple-flag\",\"active\":true,\"filters\":{\"groups\":[{\"properties\":[]}]}}";
        assertEquals(FlagValue.TRUE, evalFlag(raw, "anyone", null));
    }

    @Test
    void stringPropertyMatch() throws Exception {
        var raw = "{\"id\":107198,\"team_id\":72878,\"name\":\"\",\"key\":\"test\",\"filters\":{\"groups\":[{\"variant\":null,\"properties\":[{\"key\":\"username\",\"type\":\"person\",\"value\":[\"person-a\",\"person-b\"],\"operator\":\"exact\"}],\"rollout_percentage\":100}],\"payloads\":{},\"multivariate\":null},\"deleted\":false,\"active\":true,\"ensure_experience_continuity\":false}";

        assertEquals(FlagValue.TRUE, evalFlag(raw, "person-a", Map.of("username", "person-a"))); // Person in group
        assertEquals(FlagValue.FALSE, evalFlag(raw, "person-c", Map.of("username", "person-c"))); // Person not in group
        assertThrows(InconclusiveMatchException.class, () -> evalFlag(raw, "person-a", Map.of("something", "else"))); // No username context
        assertThrows(InconclusiveMatchException.class, () -> evalFlag(raw, "person-c", null)); // No context at all
    }

    @Test
    void distinctIdIsAProperty() throws Exception {
        var raw = "{\"id\":1,\"key\":\"test\",\"active\":true,\"filters\":{\"groups\":[{\"properties\":[{\"key\":\"distinct_id\",\"type\":\"person\",\"value\":[\"person-a\"],\"operator\":\"exact\"}],\"rollout_percentage\":100}]}}";
        assertEquals(FlagValue.TRUE, evalFlag(raw, "person-a", null));
        assertEquals(FlagValue.FALSE, evalFlag(raw, "person-b", null));
    }

    @Test
    void laterConditionMatchesDespiteInconclusiveOne() throws Exception {
        var raw = "{\"id\":1,\"key\":\"test\",\"active\":true,\"filters\":{\"groups\":[{\"properties\":[{\"key\":\"region\",\"type\":\"person\",\"value\":\"eu\"}],\"rollout_percentage\":100},{\"properties\":[],\"rollout_percentage\":100}]}}";
        assertEquals(FlagValue.TRUE, evalFlag(raw, "person-a", null));
    }

    @Test
    void inconclusiveConditionWithoutMatchIsInconclusive() {
        var raw = "{\"id\":1,\"key\":\"test\",\"active\":true,\"filters\":{\"groups\":[{\"properties\":[{\"key\":\"region\",\"type\":\"person\",\"value\":\"eu\"}],\"rollout_percentage\":100},{\"properties\":[],\"rollout_percentage\":0}]}}";
        assertThrows(InconclusiveMatchException.class, () -> evalFlag(raw, "person-a", null));
    }

    @Nested
    class GroupFlags {
        private static final String RAW = "{\"id\":1,\"key\":\"group-flag\",\"active\":true,\"filters\":{\"aggregation_group_type_index\":0,\"groups\":[{\"properties\":[{\"key\":\"plan\",\"type\":\"group\",\"value\":\"enterprise\",\"group_type_index\":0}],\"rollout_percentage\":100}]}}";
        private static final Map<String, String> MAPPING = Map.of("0", "company");

        @Test
        void matchesGroupProperties() throws Exception {
            var context = FeatureFlagContext.newBuilder()
                    .group("company", "acme")
                    .groupProperties("company", Map.of("plan", "enterprise"))
                    .build();
            assertEquals(FlagValue.TRUE, evaluate(RAW, MAPPING, context));
        }

        @Test
        void personPropertiesAreIgnored() {
            var context = FeatureFlagContext.newBuilder()
                    .groups(Map.of("company", "acme"))
                    .personProperties(Map.of("plan", "enterprise"))
                    .build();
            assertThrows(InconclusiveMatchException.class, () -> evaluate(RAW, MAPPING, context));
        }

        @Test
        void missingGroupIsDisabled() throws Exception {
            assertEquals(FlagValue.FALSE, evaluate(RAW, MAPPING, FeatureFlagContext.EMPTY));
        }

        @Test
        void unknownGroupTypeIsDisabled() throws Exception {
            var context = FeatureFlagContext.newBuilder().groups(Map.of("company", "acme")).build();
            assertEquals(FlagValue.FALSE, evaluate(RAW, Map.of(), context));
        }

        @Test
        void groupKeyIsAProperty() throws Exception {
            var raw = "{\"id\":1,\"key\":\"group-flag\",\"active\":true,\"filters\":{\"aggregation_group_type_index\":0,\"groups\":[{\"properties\":[{\"key\":\"$group_key\",\"type\":\"group\",\"value\":\"acme\",\"group_type_index\":0}],\"rollout_percentage\":100}]}}";
            var acme = FeatureFlagContext.newBuilder().groups(Map.of("company", "acme")).build();
            var other = FeatureFlagContext.newBuilder().groups(Map.of("company", "other")).build();
            assertEquals(FlagValue.TRUE, evaluate(raw, MAPPING, acme));
            assertEquals(FlagValue.FALSE, evaluate(raw, MAPPING, other));
        }

        private @NotNull FlagValue evaluate(@NotNull String raw, @NotNull Map<String, String> mapping, @NotNull FeatureFlagContext context) throws InconclusiveMatchException {
            var evaluator = new FeatureFlagEvaluator(new DependencyGraph(), Map.of(), Map.of(), mapping);
            return evaluator.evaluate(GSON.fromJson(raw, Flag.class), EvaluationInputs.from(GSON, "person-a", context));
        }
    }

    @Nested
    class Cohorts {
        private static final String FLAG = "{\"id\":1,\"key\":\"cohort-flag\",\"active\":true,\"filters\":{\"groups\":[{\"properties\":[{\"key\":\"id\",\"type\":\"cohort\",\"value\":98}],\"rollout_percentage\":100}]}}";

        @Test
        void matchesNestedCohort() throws Exception {
            var cohort = "{\"type\":\"OR\",\"values\":[{\"type\":\"AND\",\"values\":[{\"key\":\"email\",\"type\":\"person\",\"value\":\"@example.com\",\"operator\":\"icontains\"},{\"key\":\"age\",\"type\":\"person\",\"value\":18,\"operator\":\"gte\"}]}]}";
            assertEquals(FlagValue.TRUE, evaluate(cohort, Map.of("email", "bob@example.com", "age", 30)));
            assertEquals(FlagValue.FALSE, evaluate(cohort, Map.of("email", "bob@example.com", "age", 12)));
            assertEquals(FlagValue.FALSE, evaluate(cohort, Map.of("email", "bob@other.com", "age", 30)));
        }

        @Test
        void negatedLeafInverts() throws Exception {
            var cohort = "{\"type\":\"AND\",\"values\":[{\"key\":\"country\",\"type\":\"person\",\"value\":\"US\",\"operator\":\"exact\",\"negation\":true}]}";
            assertEquals(FlagValue.FALSE, evaluate(cohort, Map.of("country", "US")));
            assertEquals(FlagValue.TRUE, evaluate(cohort, Map.of("country", "DE")));
        }

        @Test
        void orGroupDecidedDespiteInconclusiveLeaf() throws Exception {
            var cohort = "{\"type\":\"OR\",\"values\":[{\"key\":\"region\",\"type\":\"person\",\"value\":\"eu\"},{\"key\":\"plan\",\"type\":\"person\",\"value\":\"pro\"}]}";
            assertEquals(FlagValue.TRUE, evaluate(cohort, Map.of("plan", "pro")));
            assertThrows(InconclusiveMatchException.class, () -> evaluate(cohort, Map.of("plan", "free")));
        }

        @Test
        void andGroupDecidedDespiteInconclusiveLeaf() throws Exception {
            var cohort = "{\"type\":\"AND\",\"values\":[{\"key\":\"region\",\"type\":\"person\",\"value\":\"eu\"},{\"key\":\"plan\",\"type\":\"person\",\"value\":\"pro\"}]}";
            assertEquals(FlagValue.FALSE, evaluate(cohort, Map.of("plan", "free")));
            assertThrows(InconclusiveMatchException.class, () -> evaluate(cohort, Map.of("plan", "pro")));
        }

        @Test
        void emptyCohortMatches() throws Exception {
            assertEquals(FlagValue.TRUE, evaluate("{\"type\":\"AND\",\"values\":[]}", Map.of()));
        }

        @Test
        void missingCohortIsInconclusive() {
            var evaluator = new FeatureFlagEvaluator(new DependencyGraph(), Map.of(), Map.of(), Map.of());
            var flag = GSON.fromJson(FLAG, Flag.class);
            assertThrows(InconclusiveMatchException.class, () -> evaluator.evaluate(flag, "person-a", new JsonObject()));
        }

        private @NotNull FlagValue evaluate(@NotNull String cohort, @NotNull Map<String, Object> person) throws InconclusiveMatchException {
            var cohorts = Map.of("98", PropertyGroup.parse(GSON, GSON.fromJson(cohort, JsonObject.class)));
            var evaluator = new FeatureFlagEvaluator(new DependencyGraph(), Map.of(), cohorts, Map.of());
            return evaluator.evaluate(GSON.fromJson(FLAG, Flag.class), "person-a", GSON.toJsonTree(person).getAsJsonObject());
        }
    }

    private static final Gson GSON = new GsonBuilder().disableJdkUnsafe().create();

    private static @NotNull FlagValue evalFlag(@NotNull String raw, @NotNull String distinctId, @Nullable Map<String, Object> person) throws InconclusiveMatchException {
        var flag = GSON.fromJson(raw, Flag.class);
        var evaluator = new FeatureFlagEvaluator(new DependencyGraph(), Map.of(), Map.of(), Map.of());
        var context = FeatureFlagContext.newBuilder().personProperties(person).build();
        return evaluator.evaluate(flag, EvaluationInputs.from(GSON, distinctId, context));
    }
}
