// Part of Stable Options
/*
 * Conventions shared by all classes in the library:
 * - Null check is performed on collaborator parameters. Options themselves may contain nulls anywhere.
 * - Options are never modified. Shaped copies are unmodifiable.
 * - Comparison and shaping never throw on strange options, including collections that fail while being iterated.
 *   Comparison then reports a change and shaping passes the failing container through unchanged.
 * - OptionsCache.update() throws only when called reentrantly.
 * - Exceptions from application callbacks propagate unchanged. They are logged only where there's nobody to propagate them to.
 * - Metrics are exposed by OptionsCache only. Rebuilds are traced, reuses are not.
 * - Method toString() is defined where useful. It uses OwnerTrace and never prints options, which may be cyclic.
 */
/**
 * Reference-stable options with live callbacks.
 * {@link com.machinezoo.stableoptions.OptionsCache} is the main entry point.
 */
package com.machinezoo.stableoptions;
