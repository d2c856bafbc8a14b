package com.flamingo.ai.chatarchive.domain.model;

/**
 * A message located by id together with the conversation that contains it.
 *
 * @param message the located message
 * @param conversation its owning conversation
 */
public record MessageMatch(Message message, Conversation conversation) {}
