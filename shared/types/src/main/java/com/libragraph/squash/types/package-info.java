/**
 * Pure Java value types shared across all squash modules.
 *
 * <p>{@link com.libragraph.squash.types.CodecKind} and
 * {@link com.libragraph.squash.types.DigestKind} name what callers ask for;
 * which backend or implementation serves the request is decided by the
 * registries in {@code modules/codecs} and {@code modules/chksum}.
 * This module has no dependencies.
 */
package com.libragraph.squash.types;
