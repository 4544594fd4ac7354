package com.talentledger;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries. The ledger adapter knows nothing of reconciliation; the HTTP surface reads through query services.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.talentledger");
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..config..", "..api..",
                        "..reconcile..", "..projection..", "..publication..", "..query..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..ingestion..", "..config..",
                        "..api..", "..reconcile..", "..projection..", "..publication..", "..query..");
        rule.check(classes);
    }

    @Test
    void ingestion_must_not_depend_on_reconcile_projection_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion..")
                .should().dependOnClassesThat().resideInAnyPackage("..reconcile..", "..projection..",
                        "..publication..", "..query..", "..api..");
        rule.check(classes);
    }

    @Test
    void projection_and_publication_must_not_depend_on_reconcile_or_api() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..projection..", "..publication..")
                .should().dependOnClassesThat().resideInAnyPackage("..reconcile..", "..ingestion..", "..api..");
        rule.check(classes);
    }

    @Test
    void reconcile_must_not_depend_on_api_or_query() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..reconcile..")
                .should().dependOnClassesThat().resideInAnyPackage("..api..", "..query..");
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
    void mirror_and_quarantine_repositories_stay_behind_stores_and_queries() {
        ArchRule rule = noClasses()
                .that().resideOutsideOfPackages("..reconcile.store..", "..query..", "..domain..")
                .should().dependOnClassesThat().haveSimpleName("AgreementRepository")
                .orShould().dependOnClassesThat().haveSimpleName("QuarantinedNotificationRepository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.talentledger.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
