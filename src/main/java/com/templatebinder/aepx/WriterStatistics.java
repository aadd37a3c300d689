package com.templatebinder.aepx;

import java.util.Map;

/**
 * Counts taken from the writer's add/remove logs, not from the document.
 */
public record WriterStatistics(int expressionsAdded, int expressionsRemoved,
                               Map<String, Integer> addedByComp, Map<String, Integer> removedByComp) {}
