package dev.eureka.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "dev.eureka", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

  // Pure algorithm packages stay free of Spring and persistence.
  @ArchTest
  static final ArchRule algorithms_should_not_depend_on_spring =
      noClasses()
          .that()
          .resideInAnyPackage("..index..", "..snippet..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("org.springframework..", "jakarta.persistence..");

  // The store is the bottom layer
  @ArchTest
  static final ArchRule store_should_not_depend_on_features =
      noClasses()
          .that()
          .resideInAPackage("..store..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "..crawl..", "..index..", "..pagerank..", "..ranking..", "..search..", "..cli..");

  // Only the batch runner orchestrates across crawl, ranking and serving
  @ArchTest
  static final ArchRule features_should_not_depend_on_cli =
      noClasses()
          .that()
          .resideOutsideOfPackage("..cli..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..cli..");

  @ArchTest
  static final ArchRule cache_should_not_depend_on_other_features =
      noClasses()
          .that()
          .resideInAPackage("..cache..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..search..", "..ranking..", "..store..");

  // Config package should not depend on feature packages
  @ArchTest
  static final ArchRule config_should_not_depend_on_features =
      noClasses()
          .that()
          .resideInAPackage("..config..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..crawl..", "..search..", "..store..", "..cli..");

  // No cyclic dependencies between top-level packages
  @ArchTest
  static final ArchRule no_package_cycles =
      slices().matching("dev.eureka.(*)..").should().beFreeOfCycles();
}
