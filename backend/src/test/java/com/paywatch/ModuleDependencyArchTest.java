package com.paywatch;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: the domain and oracle are leaves, the lifecycle never reaches the scheduler,
 * and only the API sits on top.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.paywatch");
    }

    @Test
    void domain_must_not_depend_on_services() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..store..", "..ledger..", "..lifecycle..",
                        "..monitoring..", "..oracle..", "..api..", "..config..");
        rule.check(classes);
    }

    @Test
    void oracle_must_not_depend_on_payment_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..oracle..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..store..", "..ledger..",
                        "..lifecycle..", "..monitoring..", "..api..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..store..", "..ledger..",
                        "..lifecycle..", "..monitoring..", "..oracle..", "..api..", "..config..");
        rule.check(classes);
    }

    @Test
    void lifecycle_must_not_depend_on_monitoring() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..lifecycle..")
                .should().dependOnClassesThat().resideInAnyPackage("..monitoring..", "..oracle..", "..api..");
        rule.check(classes);
    }

    @Test
    void nothing_depends_on_api() {
        ArchRule rule = noClasses()
                .that().resideOutsideOfPackage("..api..")
                .should().dependOnClassesThat().resideInAPackage("..api..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.paywatch.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
