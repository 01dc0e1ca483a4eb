package com.textgraph.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Graph model types are immutable records</li>
 *   <li>The model knows nothing about layout, rendering or parsing</li>
 *   <li>Layout stages do not depend on the renderer or the front ends</li>
 *   <li>Routers live in the routing package and implement the SPI</li>
 *   <li>YAML binding stays in the config package</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.textgraph.core");
    }

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
            .should().dependOnClassesThat()
            .resideInAnyPackage("..core.layout..", "..core.render..", "..core.parser..", "..core.config..");

        rule.check(classes);
    }

    /**
     * Layout produces geometry only; painting and input handling sit on top of it.
     */
    @Test
    void layout_shouldNotDependOnRendererOrFrontEnds() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.layout..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..core.render..", "..core.parser..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void renderer_shouldNotDependOnParserOrConfig() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.render..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.parser..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void routers_shouldResideInRoutingPackage() {
        ArchRule rule = classes()
            .that().implement("com.textgraph.core.layout.routing.EdgeRouter")
            .should().resideInAPackage("..layout.routing..");

        rule.check(classes);
    }

    @Test
    void jackson_shouldOnlyBeUsedByConfig() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..core.config..")
            .should().dependOnClassesThat().resideInAPackage("com.fasterxml.jackson..");

        rule.check(classes);
    }
}
