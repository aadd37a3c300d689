package com.templatebinder.expressions;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionSyntaxValidatorTest {

    @Test
    void acceptsWellFormedExpression() {
        ExpressionValidationResult result = ExpressionSyntaxValidator.validate(
            "var x = thisComp.layer(\"a\").text.sourceText;\nif (x == 'b') { [100, 100]; } else { [0, 0]; }");
        assertTrue(result.isValid());
        assertEquals("Syntax validation passed", result.summary());
    }

    @Test
    void reportsUnclosedDelimiters() {
        ExpressionValidationResult result = ExpressionSyntaxValidator.validate("if (x { [1, 2");
        assertFalse(result.isValid());
        assertTrue(result.getErrors().contains("Unbalanced braces: 1 unclosed"));
        assertTrue(result.getErrors().contains("Unbalanced parentheses: 1 unclosed"));
        assertTrue(result.getErrors().contains("Unbalanced brackets: 1 unclosed"));
    }

    @Test
    void reportsExtraClosingDelimiterAsNegative() {
        ExpressionValidationResult result = ExpressionSyntaxValidator.validate("var x = 5;)");
        assertEquals(1, result.getErrors().size());
        assertEquals("Unbalanced parentheses: -1 unclosed", result.getErrors().get(0));
    }

    @Test
    void reportsUnterminatedStrings() {
        assertTrue(ExpressionSyntaxValidator.validate("x = 'abc").getErrors()
            .contains("Unterminated single quote string"));
        assertTrue(ExpressionSyntaxValidator.validate("x = \"abc").getErrors()
            .contains("Unterminated double quote string"));
    }

    @Test
    void simpleDeclarationPasses() {
        assertTrue(ExpressionSyntaxValidator.validate("var x = 5;").isValid());
        assertEquals(List.of("Unterminated double quote string"),
            ExpressionSyntaxValidator.validate("say \"hi").getErrors());
    }

    @Test
    void escapedQuotesAreNotCounted() {
        assertTrue(ExpressionSyntaxValidator.validate("\"say \\\"hi\\\"\"").isValid());
    }

    @Test
    void reportsMalformedDeclaration() {
        ExpressionValidationResult result = ExpressionSyntaxValidator.validate("var 1x;");
        assertEquals(1, result.getErrors().size());
        assertEquals("Invalid variable declaration syntax", result.getErrors().get(0));
        assertTrue(result.summary().startsWith("Syntax validation failed: 1 error(s)"));
    }

    @Test
    void nullTextIsInvalid() {
        assertFalse(ExpressionSyntaxValidator.validate(null).isValid());
    }

    @Test
    void emptyTextIsValid() {
        assertTrue(ExpressionSyntaxValidator.validate("").isValid());
    }
}
