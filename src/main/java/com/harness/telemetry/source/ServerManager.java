package com.harness.telemetry.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory registry of the servers managed by this daemon.
 */
public class ServerManager implements ServerRegistry {

  private static final Logger log = LoggerFactory.getLogger(ServerManager.class);

  private final Map<String, Server> servers = new ConcurrentHashMap<>();
  private final List<Consumer<ManagedServer>> addHooks = new CopyOnWriteArrayList<>();

  @Override
  public List<ManagedServer> all() {
    return new ArrayList<>(servers.values());
  }

  @Override
  public void onServerAdd(Consumer<ManagedServer> hook) {
    addHooks.add(hook);
  }

  public Optional<Server> get(String id) {
    return Optional.ofNullable(servers.get(id));
  }

  /**
   * Add a server and notify the add hooks. A server recreated under an existing
   * id must be removed first.
   */
  public void add(Server server) {
    if (servers.putIfAbsent(server.id(), server) != null) {
      throw new IllegalArgumentException("Server already registered: " + server.id());
    }
    for (Consumer<ManagedServer> hook : addHooks) {
      try {
        hook.accept(server);
      } catch (RuntimeException e) {
        log.warn("Server add hook failed. serverId={}", server.id(), e);
      }
    }
  }

  public Optional<Server> remove(String id) {
    Server removed = servers.remove(id);
    if (removed != null) {
      removed.destroy();
    }
    return Optional.ofNullable(removed);
  }
}
