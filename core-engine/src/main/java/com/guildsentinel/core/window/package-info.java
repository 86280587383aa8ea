/**
 * Per-user sliding windows of recent message fingerprints.
 *
 * <p>
 * {@link com.guildsentinel.core.window.WindowStore#record} is the single
 * intake step; rules only ever see immutable
 * {@link com.guildsentinel.core.window.WindowSnapshot}s.
 * </p>
 */
package com.guildsentinel.core.window;
