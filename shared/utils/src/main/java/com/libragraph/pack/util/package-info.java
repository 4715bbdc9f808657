/**
 * Shared utilities for all pack modules.
 *
 * <p>Contains {@link com.libragraph.pack.util.AnchorScanner} (bounded forward
 * scans used by the index parser and the Ogg repair engine) and the
 * {@link com.libragraph.pack.util.buffer buffer layer} (BinaryData and its
 * file, memory and slice variants).
 */
package com.libragraph.pack.util;
