/**
 * Confidence, impact, urgency and priority of rule firings.
 *
 * @since 1.0.0
 */
package com.scoutengine.core.scoring;
