package com.econlens.core.model;

/**
 * One value of a categorical catalog dimension (an area, an item, an industry...).
 *
 * @param code         value used in filters
 * @param name         display name
 * @param displayLevel depth in the outline, 0 for top level
 * @param selectable   whether series exist for this value on its own
 * @param sortSequence position in the published outline
 */
public record DimensionOption(String code, String name, int displayLevel, boolean selectable, int sortSequence) {}
