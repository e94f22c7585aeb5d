package io.stubmatch.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;
import io.stubmatch.core.matcher.Expectation;

/**
 * Architecture guardrails for the core module.
 *
 * <p>The request model and the expectation variants never see Jackson; only
 * the document codec ({@code spec}) does.
 */
@AnalyzeClasses(
        packages = "io.stubmatch.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule modelStandsAlone = noClasses()
            .that()
            .resideInAPackage("io.stubmatch.core.model..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("com.fasterxml..", "io.stubmatch.core.matcher..", "io.stubmatch.core.spec..")
            .because("the request model is a plain value type shared by every caller");

    @ArchTest
    static final ArchRule matcherDoesNotDependOnCodec = noClasses()
            .that()
            .resideInAPackage("io.stubmatch.core.matcher..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("com.fasterxml..", "io.stubmatch.core.spec..")
            .because("matching must not depend on how expectations are serialized");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("reflection is not used in the core");

    @ArchTest
    static final ArchRule expectationVariantsAreImmutable = classes()
            .that()
            .implement(Expectation.class)
            .should()
            .haveOnlyFinalFields()
            .because("expectations are shared across threads during matching");

    @ArchTest
    static final ArchRule valueTypesHaveOnlyFinalFields = classes()
            .that()
            .haveSimpleName("Request")
            .or()
            .haveSimpleName("QueryParams")
            .or()
            .haveSimpleName("Expectations")
            .should()
            .haveOnlyFinalFields()
            .because("requests and rule sets are read concurrently without coordination");
}
