package com.flamingo.ai.chatarchive.domain.model.statistics;

import com.flamingo.ai.chatarchive.domain.enums.MessageRole;

/** Message breakdown by role. */
public record RoleCount(int user, int assistant, int system) {

  public static final RoleCount EMPTY = new RoleCount(0, 0, 0);

  public int total() {
    return user + assistant + system;
  }

  public int count(MessageRole role) {
    return switch (role) {
      case USER -> user;
      case ASSISTANT -> assistant;
      case SYSTEM -> system;
    };
  }

  /** Returns a copy with one more message of the given role. */
  public RoleCount plus(MessageRole role) {
    return switch (role) {
      case USER -> new RoleCount(user + 1, assistant, system);
      case ASSISTANT -> new RoleCount(user, assistant + 1, system);
      case SYSTEM -> new RoleCount(user, assistant, system + 1);
    };
  }
}
