/**
 * Shared utilities for all squash modules.
 *
 * <p>Contains {@link com.libragraph.squash.util.AtomicWriteFile} (commit-or-discard
 * file writes), {@link com.libragraph.squash.util.CpuTopology} (physical core count)
 * and {@link com.libragraph.squash.util.DigestValue}.
 * No framework dependencies, only JBoss Logging.
 */
package com.libragraph.squash.util;
