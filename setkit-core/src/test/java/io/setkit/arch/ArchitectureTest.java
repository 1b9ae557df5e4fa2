package io.setkit.arch;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

class ArchitectureTest {

    @Test
    void coreShouldNotDependOnCollections() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.setkit.core..")
                .should().dependOnClassesThat().resideInAPackage("io.setkit.collect..");
        rule.check(importedMainClasses());
    }

    @Test
    void internalShouldOnlyBeUsedByCollections() {
        ArchRule rule = classes()
                .that().resideInAPackage("io.setkit.collect.internal..")
                .should().onlyHaveDependentClassesThat()
                .resideInAnyPackage("io.setkit.collect..");
        rule.check(importedMainClasses());
    }

    @Test
    void internalShouldNotDependOnContainers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.setkit.collect.internal..")
                .should().dependOnClassesThat().resideInAnyPackage("io.setkit.collect", "io.setkit.core..");
        rule.check(importedMainClasses());
    }

    @Test
    void containersShouldNotLog() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.setkit.collect..")
                .should().dependOnClassesThat().resideInAPackage("org.slf4j..");
        rule.check(importedMainClasses());
    }

    private static JavaClasses importedMainClasses() {
        return new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("io.setkit");
    }
}
