package com.pipedef.publisher.discovery;

import com.pipedef.definitions.DefinitionBase;
import com.pipedef.publisher.fixtures.AbstractFixturePipeline;
import com.pipedef.publisher.fixtures.AlphaPipeline;
import com.pipedef.publisher.fixtures.DeepPipeline;
import com.pipedef.publisher.fixtures.NotADefinition;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefinitionTypePredicateTest {

    interface Publishable {
    }

    interface YamlPublishable extends Publishable {
    }

    public static class ViaInterface implements YamlPublishable {
    }

    public abstract static class AbstractViaInterface implements Publishable {
    }

    private final DefinitionTypePredicate predicate = DefinitionTypePredicate.forContract(DefinitionBase.class);

    @Test
    void test_matchesDirectAndTransitiveSubclasses() {
        assertTrue(predicate.test(AlphaPipeline.class));
        assertTrue(predicate.test(DeepPipeline.class));
    }

    @Test
    void test_rejectsAbstractTypesAndUnrelatedTypes() {
        assertFalse(predicate.test(AbstractFixturePipeline.class));
        assertFalse(predicate.test(DefinitionBase.class));
        assertFalse(predicate.test(NotADefinition.class));
        assertFalse(predicate.test(String.class));
        assertFalse(predicate.test(null));
    }

    @Test
    void test_walksInterfaceHierarchy() {
        DefinitionTypePredicate byInterface = DefinitionTypePredicate.forContract(Publishable.class);

        assertTrue(byInterface.test(ViaInterface.class));
        assertFalse(byInterface.test(AbstractViaInterface.class));
        assertFalse(byInterface.test(YamlPublishable.class));
    }

    @Test
    void test_matchesByNameNotIdentity() {
        DefinitionTypePredicate byName = new DefinitionTypePredicate("com.pipedef.definitions.DefinitionBase");

        assertTrue(byName.test(AlphaPipeline.class));
        assertFalse(new DefinitionTypePredicate("com.other.DefinitionBase").test(AlphaPipeline.class));
    }

    @Test
    void test_rejectsAnonymousClasses() {
        Object anonymous = new Publishable() {
        };

        assertFalse(DefinitionTypePredicate.forContract(Publishable.class).test(anonymous.getClass()));
    }
}
