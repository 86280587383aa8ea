/**
 * Gateway listeners.
 */
package com.guildsentinel.bot.listener;
