/**
 * JSON encodings of records and boost factors exchanged with upstream and downstream systems and
 * between stage workers.
 */
package org.adsabs.boost.application.codec;
