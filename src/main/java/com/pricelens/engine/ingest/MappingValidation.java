package com.pricelens.engine.ingest;

import java.util.List;

/**
 * @param missing keys of required fields without a column, in field order
 */
public record MappingValidation(boolean valid, List<String> missing) {}
