package dev.campfire.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.campfire", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // Feature packages should not depend on adapter packages.
    @ArchTest
    static final ArchRule features_should_not_depend_on_adapters =
        noClasses().that().resideInAnyPackage(
                "..validation..", "..source..", "..job..", "..discovery..", "..dedup..",
                "..catalog..", "..alert.."
            )
            .should().dependOnClassesThat().resideInAnyPackage(
                "..mcp..", "..api.."
            );

    // Adapter packages should not depend on each other
    @ArchTest
    static final ArchRule adapters_should_not_depend_on_each_other =
        noClasses().that().resideInAPackage("..mcp..")
            .should().dependOnClassesThat().resideInAPackage("..api..");

    // Record validation never touches persistence
    @ArchTest
    static final ArchRule validation_does_not_use_persistence =
        noClasses().that().resideInAPackage("..validation..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "jakarta.persistence..", "org.springframework.data.."
            );

    // Config package should not depend on feature or adapter packages
    @ArchTest
    static final ArchRule config_should_not_depend_on_features =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..mcp..", "..api..", "..source..", "..job..", "..discovery..", "..dedup.."
            );

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.campfire.(*)..").should().beFreeOfCycles();
}
