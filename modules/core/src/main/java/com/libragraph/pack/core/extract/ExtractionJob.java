package com.libragraph.pack.core.extract;

import com.libragraph.pack.formats.gpk.PackageEntry;

import java.nio.file.Path;

/**
 * One entry to write during bulk extraction.
 *
 * @param index       position of the entry in the catalog
 * @param entry       the entry
 * @param destination resolved output file
 */
record ExtractionJob(int index, PackageEntry entry, Path destination) {
}
