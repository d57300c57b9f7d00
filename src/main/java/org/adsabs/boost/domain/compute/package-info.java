/**
 * Boost computation: pure functions over records and ranking tables.
 *
 * <p>Nothing in this package performs I/O; time enters as an explicit argument.</p>
 */
package org.adsabs.boost.domain.compute;
