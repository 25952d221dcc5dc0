package com.panelforge.plan.validation;

import com.panelforge.plan.model.GridSpecification;
import com.panelforge.plan.model.PromotionPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlanValidatorTest {

    @TempDir
    Path tempDir;

    private Path masterGrid;
    private final PlanValidator validator = new PlanValidator();

    @BeforeEach
    void setUp() throws Exception {
        masterGrid = Files.write(tempDir.resolve("master.png"), new byte[]{1, 2, 3});
    }

    private PromotionPlan.Builder validPlan() {
        return PromotionPlan.builder()
                .masterGridPath(masterGrid)
                .outputDirectory(tempDir.resolve("out"))
                .gridSpecification("3x3")
                .globalSeed(42)
                .addPanel("panel_01", 0, 0, "hero")
                .addPanel("panel_02", 2, 1, "villain");
    }

    @Test
    void validate_acceptsValidPlan() {
        ValidationResult result = validator.validate(validPlan().build());

        assertTrue(result.isValid(), result.toString());
        assertEquals(GridSpecification.parse("3x3"), validator.requireValid(validPlan().build()));
    }

    @Test
    void validate_rejectsMalformedGridSpecificationWithWorkedExample() {
        ValidationResult result = validator.validate(validPlan().gridSpecification("3x").build());

        assertFalse(result.isValid());
        assertTrue(result.getErrors().get(0).contains("\"3x2\" = 3 columns, 2 rows"), result.getErrors().get(0));
    }

    @Test
    void validate_rejectsDuplicatePositionsAndIds() {
        PromotionPlan plan = validPlan()
                .addPanel("panel_03", 0, 0, "copy of hero position")
                .addPanel("panel_01", 1, 1, "copy of hero id")
                .build();

        ValidationResult result = validator.validate(plan);

        assertFalse(result.isValid());
        assertEquals(2, result.getErrors().size(), result.toString());
        assertTrue(result.getErrors().stream().anyMatch(e -> e.startsWith("duplicate grid_position [row=0, col=0]")));
        assertTrue(result.getErrors().stream().anyMatch(e -> e.startsWith("duplicate panel_id \"panel_01\"")));
    }

    @Test
    void validate_rejectsPositionOutsideGrid() {
        PromotionPlan plan = validPlan().gridSpecification("3x2").addPanel("panel_09", 2, 0, "").build();

        ValidationResult result = validator.validate(plan);

        assertFalse(result.isValid());
        assertTrue(result.getErrors().stream().anyMatch(e -> e.contains("outside grid 3x2")), result.toString());
    }

    @Test
    void validate_rejectsMissingMasterGridAndSeed() {
        PromotionPlan plan = new PromotionPlan(tempDir.resolve("missing.png").toString(),
                tempDir.toString(), "2x2", null, null, validPlan().build().getPanels().subList(0, 1));

        ValidationResult result = validator.validate(plan);

        assertTrue(result.getErrors().contains("global_seed is required"));
        assertTrue(result.getErrors().stream().anyMatch(e -> e.startsWith("master grid image not found")));
    }

    @Test
    void validate_rejectsEmptyPanelList() {
        PromotionPlan plan = PromotionPlan.builder()
                .masterGridPath(masterGrid).outputDirectory(tempDir).gridSpecification("1x1").globalSeed(1).build();

        assertTrue(validator.validate(plan).getErrors().contains("plan has no panels"));
    }

    @Test
    void requireValid_throwsWithAllErrors() {
        PromotionPlan plan = validPlan().gridSpecification("0x3").build();

        PlanValidationException e = assertThrows(PlanValidationException.class, () -> validator.requireValid(plan));

        assertFalse(e.getValidationResult().isValid());
        assertTrue(e.getMessage().startsWith("Invalid promotion plan: "));
    }
}
