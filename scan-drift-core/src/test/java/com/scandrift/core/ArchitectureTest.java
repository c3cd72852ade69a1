package com.scandrift.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the layering of the reconciliation engine.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Models and identity parsing stay free of API clients</li>
 *   <li>Report generators work on results only, never on live clients</li>
 *   <li>The core module never reaches into the CLI</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.scandrift.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.client..", "..core.catalog..", "..core.reconcile..", "..core.report..", "..core.renderer..");

        rule.check(classes);
    }

    /**
     * URL parsing is pure; it must work without any platform client on the classpath.
     */
    @Test
    void identity_shouldNotDependOnClients() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.identity..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.client..", "..core.http..", "..core.fetch..");

        rule.check(classes);
    }

    @Test
    void clients_shouldNotDependOnReconciliation() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.client..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.catalog..", "..core.reconcile..", "..core.report..");

        rule.check(classes);
    }

    @Test
    void reports_shouldNotDependOnClients() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.report..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.client..", "..core.http..", "..core.fetch..", "..core.reconcile..");

        rule.check(classes);
    }

    @Test
    void core_shouldNotDependOnCli() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("com.scandrift.core..")
            .should().dependOnClassesThat().resideInAPackage("com.scandrift.cli..");

        rule.check(classes);
    }
}
