// Part of Stable Options
/**
 * Binding of stabilized options to long-lived widgets.
 */
package com.machinezoo.stableoptions.binding;
