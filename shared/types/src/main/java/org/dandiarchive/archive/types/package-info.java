/**
 * Pure Java value types shared across all archive modules.
 *
 * <p>These enums are persisted by the core module; {@code ValidationStatus} is stored
 * by its numeric id, the others by name.
 */
package org.dandiarchive.archive.types;
