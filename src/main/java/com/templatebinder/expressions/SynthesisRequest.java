package com.templatebinder.expressions;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * A request to synthesize one expression pattern. Which fields are read depends on
 * {@code pattern}:
 * <ul>
 *   <li>textLink: variable (optional)</li>
 *   <li>concatenate: variables, separators (optional)</li>
 *   <li>conditionalVisibilityText: variable, targetValue, visibleWhenMatch</li>
 *   <li>conditionalVisibilityNumber: variable, targetNumber, visibleWhenMatch</li>
 *   <li>logoScaleToFit: maxWidth, maxHeight</li>
 *   <li>imageScaleToComp: mode</li>
 *   <li>hexColorToRgb: variable</li>
 *   <li>rankingDisplay: variable, parenthesized</li>
 *   <li>compareNumbers: variable, secondVariable, operator</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SynthesisRequest {
    private String pattern;
    private String variable;
    private String secondVariable;
    private List<String> variables;
    private List<String> separators;
    private String targetValue;
    private Integer targetNumber;
    private boolean visibleWhenMatch = true;
    private int maxWidth = 500;
    private int maxHeight = 500;
    private ScaleMode mode = ScaleMode.FIT;
    private boolean parenthesized;
    private ComparisonOperator operator;

    public String getPattern() { return pattern; }
    public void setPattern(String pattern) { this.pattern = pattern; }

    public String getVariable() { return variable; }
    public void setVariable(String variable) { this.variable = variable; }

    public String getSecondVariable() { return secondVariable; }
    public void setSecondVariable(String secondVariable) { this.secondVariable = secondVariable; }

    public List<String> getVariables() { return variables; }
    public void setVariables(List<String> variables) { this.variables = variables; }

    public List<String> getSeparators() { return separators; }
    public void setSeparators(List<String> separators) { this.separators = separators; }

    public String getTargetValue() { return targetValue; }
    public void setTargetValue(String targetValue) { this.targetValue = targetValue; }

    public Integer getTargetNumber() { return targetNumber; }
    public void setTargetNumber(Integer targetNumber) { this.targetNumber = targetNumber; }

    public boolean isVisibleWhenMatch() { return visibleWhenMatch; }
    public void setVisibleWhenMatch(boolean visibleWhenMatch) { this.visibleWhenMatch = visibleWhenMatch; }

    public int getMaxWidth() { return maxWidth; }
    public void setMaxWidth(int maxWidth) { this.maxWidth = maxWidth; }

    public int getMaxHeight() { return maxHeight; }
    public void setMaxHeight(int maxHeight) { this.maxHeight = maxHeight; }

    public ScaleMode getMode() { return mode; }
    public void setMode(ScaleMode mode) { this.mode = mode; }

    public boolean isParenthesized() { return parenthesized; }
    public void setParenthesized(boolean parenthesized) { this.parenthesized = parenthesized; }

    public ComparisonOperator getOperator() { return operator; }
    public void setOperator(ComparisonOperator operator) { this.operator = operator; }

    public String synthesize(ExpressionSynthesizer synthesizer) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern is required");
        }
        switch (pattern) {
            case "textLink":
                return variable == null || variable.isBlank()
                    ? synthesizer.textLink()
                    : synthesizer.textLink(variable);
            case "concatenate":
                return separators == null
                    ? synthesizer.concatenate(variables)
                    : synthesizer.concatenate(variables, separators);
            case "conditionalVisibilityText":
                return synthesizer.conditionalVisibilityText(required(variable, "variable"), targetValue,
                    visibleWhenMatch);
            case "conditionalVisibilityNumber":
                if (targetNumber == null) {
                    throw new IllegalArgumentException("targetNumber is required");
                }
                return synthesizer.conditionalVisibilityNumber(required(variable, "variable"), targetNumber,
                    visibleWhenMatch);
            case "logoScaleToFit":
                return synthesizer.logoScaleToFit(maxWidth, maxHeight);
            case "imageScaleToComp":
                return synthesizer.imageScaleToComp(mode);
            case "hexColorToRgb":
                return synthesizer.hexColorToRgb(required(variable, "variable"));
            case "rankingDisplay":
                return synthesizer.rankingDisplay(required(variable, "variable"), parenthesized);
            case "compareNumbers":
                return synthesizer.compareNumbers(required(variable, "variable"),
                    required(secondVariable, "secondVariable"), operator);
            default:
                throw new IllegalArgumentException("Unknown expression pattern: " + pattern);
        }
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }
}
