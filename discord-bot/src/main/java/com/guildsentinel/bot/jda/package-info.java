/**
 * JDA implementation of the outbound moderation API.
 */
package com.guildsentinel.bot.jda;
