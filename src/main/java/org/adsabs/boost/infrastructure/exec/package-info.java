/**
 * Thread pools and the in-process stage scheduler.
 */
package org.adsabs.boost.infrastructure.exec;
