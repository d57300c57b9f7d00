/**
 * Batch orchestration and the compute, store and send stage chain.
 */
package org.adsabs.boost.application.pipeline;
