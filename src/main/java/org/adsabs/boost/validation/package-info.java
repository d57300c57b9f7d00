/**
 * Validation helpers for configuration and command-line values.
 */
package org.adsabs.boost.validation;
