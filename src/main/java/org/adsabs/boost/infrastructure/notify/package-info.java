/**
 * Non-broker notification adapters.
 */
package org.adsabs.boost.infrastructure.notify;
