/**
 * Destinations for detected opportunities.
 *
 * @since 1.0.0
 */
package com.scoutengine.core.sink;
