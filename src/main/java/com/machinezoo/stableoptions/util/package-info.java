// Part of Stable Options
/**
 * Debugging utilities.
 */
package com.machinezoo.stableoptions.util;
