/**
 * JDBC storage of boost factors.
 */
package org.adsabs.boost.infrastructure.persistence;
