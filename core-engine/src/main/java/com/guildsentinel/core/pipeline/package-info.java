/**
 * Sharded in-process runtime that wires window, engine, executor and audit
 * log together, plus its Micrometer metrics.
 *
 * @since 1.0.0
 */
package com.guildsentinel.core.pipeline;
