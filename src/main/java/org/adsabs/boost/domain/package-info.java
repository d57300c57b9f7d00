/**
 * Domain model of the boost pipeline: records, keys, boosts and disciplines.
 */
package org.adsabs.boost.domain;
