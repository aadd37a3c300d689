package com.templatebinder.aepx;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExportResult {
    private final boolean success;
    private final String outputPath;
    private final Integer count;
    private final String message;

    private ExportResult(boolean success, String outputPath, Integer count, String message) {
        this.success = success;
        this.outputPath = outputPath;
        this.count = count;
        this.message = message;
    }

    static ExportResult exported(String outputPath, int count) {
        return new ExportResult(true, outputPath, count, "Exported " + count + " expressions");
    }

    static ExportResult saved(String outputPath) {
        return new ExportResult(true, outputPath, null, "Saved to " + outputPath);
    }

    static ExportResult failure(String message) {
        return new ExportResult(false, null, null, message);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public Integer getCount() {
        return count;
    }

    public String getMessage() {
        return message;
    }
}
