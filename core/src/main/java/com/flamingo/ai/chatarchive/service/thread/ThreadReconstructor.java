package com.flamingo.ai.chatarchive.service.thread;

import com.flamingo.ai.chatarchive.domain.model.Conversation;
import com.flamingo.ai.chatarchive.domain.model.Message;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Navigates the reply tree of one conversation.
 *
 * <p>A message is a root when it has no parent, when its parent id is not in the conversation, or
 * when it names itself as parent. Children keep the order of the conversation's message list, so
 * every traversal is deterministic. Parent cycles are cut rather than followed; messages that are
 * only reachable through a cycle belong to no thread.
 */
public final class ThreadReconstructor {

  private final Map<String, Message> byId;
  private final Map<String, List<Message>> childrenById;
  private final List<Message> roots;

  private ThreadReconstructor(Conversation conversation) {
    Map<String, Message> index = new LinkedHashMap<>();
    for (Message message : conversation.messages()) {
      index.put(message.id(), message);
    }
    Map<String, List<Message>> children = new HashMap<>();
    List<Message> rootList = new ArrayList<>();
    for (Message message : conversation.messages()) {
      if (isRoot(message, index)) {
        rootList.add(message);
      } else {
        children.computeIfAbsent(message.parentId(), key -> new ArrayList<>()).add(message);
      }
    }
    this.byId = index;
    this.childrenById = children;
    this.roots = List.copyOf(rootList);
  }

  public static ThreadReconstructor of(Conversation conversation) {
    return new ThreadReconstructor(conversation);
  }

  /** Messages that start a thread, in message-list order. */
  public List<Message> rootMessages() {
    return roots;
  }

  /** Direct replies to {@code messageId}; empty for leaves and unknown ids. */
  public List<Message> children(String messageId) {
    List<Message> children = childrenById.get(messageId);
    return children == null ? List.of() : Collections.unmodifiableList(children);
  }

  /**
   * Chain from a root down to {@code messageId}, both inclusive.
   *
   * @return the chain, or an empty list when the id is unknown
   */
  public List<Message> threadTo(String messageId) {
    Message current = byId.get(messageId);
    if (current == null) {
      return List.of();
    }
    List<Message> chain = new ArrayList<>();
    Set<String> visited = new HashSet<>();
    while (current != null && visited.add(current.id())) {
      chain.add(current);
      current = isRoot(current, byId) ? null : byId.get(current.parentId());
    }
    Collections.reverse(chain);
    return List.copyOf(chain);
  }

  /** Every root-to-leaf path, depth first, roots and children in message-list order. */
  public List<List<Message>> allThreads() {
    List<List<Message>> threads = new ArrayList<>();
    for (Message root : roots) {
      collectThreads(root, threads);
    }
    return threads;
  }

  private void collectThreads(Message root, List<List<Message>> threads) {
    Deque<Frame> stack = new ArrayDeque<>();
    List<Message> path = new ArrayList<>();
    Set<String> onPath = new HashSet<>();
    stack.push(new Frame(root, 0));
    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      while (path.size() > frame.depth()) {
        onPath.remove(path.remove(path.size() - 1).id());
      }
      Message message = frame.message();
      path.add(message);
      onPath.add(message.id());

      List<Message> next = new ArrayList<>();
      for (Message child : children(message.id())) {
        if (!onPath.contains(child.id())) {
          next.add(child);
        }
      }
      if (next.isEmpty()) {
        threads.add(List.copyOf(path));
        continue;
      }
      for (int i = next.size() - 1; i >= 0; i--) {
        stack.push(new Frame(next.get(i), frame.depth() + 1));
      }
    }
  }

  private static boolean isRoot(Message message, Map<String, Message> index) {
    String parentId = message.parentId();
    return parentId == null || parentId.equals(message.id()) || !index.containsKey(parentId);
  }

  private record Frame(Message message, int depth) {}
}
