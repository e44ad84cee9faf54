/**
 * Pure Java value types shared across all Unpack modules.
 *
 * <p>{@link com.libragraph.unpack.types.Document} is the record shape produced by loaders.
 * This module has no framework dependencies.
 */
package com.libragraph.unpack.types;
