package com.stagehand.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stagehand.orchestrator.model.GateRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GateValidatorTest {

    private GateValidator validator;

    @BeforeEach
    void setUp() {
        validator = new GateValidator(new OutputParser(new ObjectMapper()));
    }

    @Test
    void approval_alwaysSatisfied() {
        assertThat(validator.isSatisfied(GateRule.approval(), null)).isTrue();
        assertThat(validator.isSatisfied(GateRule.approval(), "")).isTrue();
    }

    @Test
    void nullRule_isSatisfied() {
        assertThat(validator.isSatisfied(null, null)).isTrue();
    }

    // ------------------------------------------------------------------
    // require_selection
    // ------------------------------------------------------------------

    @Test
    void selection_withinBounds_isSatisfied() {
        GateRule rule = GateRule.selection(1, 2);
        assertThat(validator.isSatisfied(rule, "[{\"id\":\"a\"}]")).isTrue();
        assertThat(validator.isSatisfied(rule, "[{\"id\":\"a\"},{\"id\":\"b\"}]")).isTrue();
    }

    @Test
    void selection_outOfBounds_isRejected() {
        GateRule rule = GateRule.selection(1, 1);
        assertThat(validator.isSatisfied(rule, "[]")).isFalse();
        assertThat(validator.isSatisfied(rule, "[1,2]")).isFalse();
    }

    @Test
    void selection_emptyDecision_isRejected() {
        assertThat(validator.isSatisfied(GateRule.selection(1, 1), null)).isFalse();
        assertThat(validator.isSatisfied(GateRule.selection(1, 1), "")).isFalse();
    }

    @Test
    void selection_plainText_countsAsSinglePick() {
        assertThat(validator.isSatisfied(GateRule.selection(1, 1), "Option B please")).isTrue();
    }

    @Test
    void selection_plainText_rejectedWhenRangeExcludesOne() {
        assertThat(validator.isSatisfied(GateRule.selection(2, 3), "just one option")).isFalse();
        assertThat(validator.isSatisfied(GateRule.selection(0, 0), "just one option")).isFalse();
        assertThat(validator.isSatisfied(GateRule.selection(0, 5), "just one option")).isTrue();
        assertThatThrownBy(() -> validator.check(GateRule.selection(2, 3), "just one option"))
                .isInstanceOf(GateViolationException.class);
    }

    @Test
    void selection_jsonObject_isRejected() {
        assertThat(validator.isSatisfied(GateRule.selection(1, 1), "{\"id\":\"a\"}")).isFalse();
    }

    // ------------------------------------------------------------------
    // require_all_checked
    // ------------------------------------------------------------------

    @Test
    void allChecked_everyItemChecked_isSatisfied() {
        String decision = "[{\"id\":\"1\",\"checked\":true},{\"id\":\"2\",\"checked\":1}]";
        assertThat(validator.isSatisfied(GateRule.allChecked(), decision)).isTrue();
    }

    @Test
    void allChecked_oneUnchecked_isRejected() {
        String decision = "[{\"id\":\"1\",\"checked\":true},{\"id\":\"2\",\"checked\":false}]";
        assertThat(validator.isSatisfied(GateRule.allChecked(), decision)).isFalse();
    }

    @Test
    void allChecked_missingFlag_isRejected() {
        assertThat(validator.isSatisfied(GateRule.allChecked(), "[{\"id\":\"1\"}]")).isFalse();
    }

    @Test
    void allChecked_emptyArray_isSatisfied() {
        assertThat(validator.isSatisfied(GateRule.allChecked(), "[]")).isTrue();
    }

    @Test
    void allChecked_notJson_isRejected() {
        assertThat(validator.isSatisfied(GateRule.allChecked(), "done")).isFalse();
    }

    // ------------------------------------------------------------------
    // require_fields
    // ------------------------------------------------------------------

    @Test
    void fields_allPresent_isSatisfied() {
        GateRule rule = GateRule.fields(List.of("title", "description"));
        assertThat(validator.isSatisfied(rule, "{\"title\":\"T\",\"description\":\"D\"}")).isTrue();
    }

    @Test
    void fields_blankValue_isRejected() {
        GateRule rule = GateRule.fields(List.of("title", "description"));
        assertThat(validator.isSatisfied(rule, "{\"title\":\"T\",\"description\":\"   \"}")).isFalse();
        assertThat(validator.isSatisfied(rule, "{\"title\":\"T\"}")).isFalse();
    }

    @Test
    void fields_notJson_isRejected() {
        assertThat(validator.isSatisfied(GateRule.fields(List.of("title")), "title")).isFalse();
    }

    @Test
    void fields_noneRequired_acceptsAnyObject() {
        assertThat(validator.isSatisfied(GateRule.fields(List.of()), "{}")).isTrue();
    }

    // ------------------------------------------------------------------
    // check
    // ------------------------------------------------------------------

    @Test
    void check_violation_throwsWithReadableMessage() {
        assertThatThrownBy(() -> validator.check(GateRule.selection(1, 1), "[]"))
                .isInstanceOf(GateViolationException.class)
                .hasMessageContaining("Select exactly 1 item(s)");

        assertThatThrownBy(() -> validator.check(GateRule.fields(List.of("title")), "{}"))
                .isInstanceOf(GateViolationException.class)
                .hasMessageContaining("title");
    }

    @Test
    void gateRule_selectionBoundsValidated() {
        assertThatThrownBy(() -> GateRule.selection(2, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GateRule.selection(-1, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
