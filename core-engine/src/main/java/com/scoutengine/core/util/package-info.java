/**
 * Small shared helpers.
 */
package com.scoutengine.core.util;
