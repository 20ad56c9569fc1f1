/**
 * Query surface over the store, collector and detector, consumed by an
 * external API layer.
 *
 * @since 1.0.0
 */
package com.healthsentinel.core.query;
