package com.goerdes.pdbdbi.model;

import lombok.Builder;
import lombok.Singular;

import java.util.List;

/**
 * A module record together with the source files the file info substream
 * attributes to it. Built in two passes: the module record first, its source
 * files once the file info substream has been decoded.
 *
 * @param info        the module record
 * @param sourceFiles source file names in file info order
 */
@Builder
public record ModuleInfoEx(ModInfo info, @Singular List<String> sourceFiles) {
}
