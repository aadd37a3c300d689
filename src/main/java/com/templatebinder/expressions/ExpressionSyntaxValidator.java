package com.templatebinder.expressions;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static sanity checks on expression text before it is written to a document.
 * Not a parser: it catches unbalanced delimiters, unterminated strings and
 * malformed {@code var} declarations, nothing more.
 */
public final class ExpressionSyntaxValidator {

    private static final Pattern UNESCAPED_SINGLE_QUOTE = Pattern.compile("(?<!\\\\)'");
    private static final Pattern UNESCAPED_DOUBLE_QUOTE = Pattern.compile("(?<!\\\\)\"");
    private static final Pattern VAR_DECLARATION = Pattern.compile("\\bvar\\s+\\w+\\s*=");

    private ExpressionSyntaxValidator() {
    }

    public static ExpressionValidationResult validate(String expression) {
        if (expression == null) {
            return ExpressionValidationResult.of(List.of("Expression text is missing"));
        }
        List<String> errors = new ArrayList<>();

        int braces = count(expression, '{') - count(expression, '}');
        if (braces != 0) {
            errors.add("Unbalanced braces: " + braces + " unclosed");
        }
        int parens = count(expression, '(') - count(expression, ')');
        if (parens != 0) {
            errors.add("Unbalanced parentheses: " + parens + " unclosed");
        }
        int brackets = count(expression, '[') - count(expression, ']');
        if (brackets != 0) {
            errors.add("Unbalanced brackets: " + brackets + " unclosed");
        }

        if (countMatches(UNESCAPED_SINGLE_QUOTE, expression) % 2 != 0) {
            errors.add("Unterminated single quote string");
        }
        if (countMatches(UNESCAPED_DOUBLE_QUOTE, expression) % 2 != 0) {
            errors.add("Unterminated double quote string");
        }

        if (expression.contains("var ") && !VAR_DECLARATION.matcher(expression).find()) {
            errors.add("Invalid variable declaration syntax");
        }

        return ExpressionValidationResult.of(errors);
    }

    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int n = 0;
        while (matcher.find()) {
            n++;
        }
        return n;
    }
}
