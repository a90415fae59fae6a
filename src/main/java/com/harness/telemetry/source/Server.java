package com.harness.telemetry.source;

public class Server implements ManagedServer {

  private final String id;
  private final Sink events;
  private final Sink console;
  private final CancellationSignal context = new CancellationSignal();

  public Server(String id) {
    this.id = id;
    this.events = new Sink(id + "/events");
    this.console = new Sink(id + "/console");
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public Sink events() {
    return events;
  }

  @Override
  public Sink console() {
    return console;
  }

  @Override
  public CancellationSignal context() {
    return context;
  }

  /**
   * Cancel the server's context and close both buses.
   */
  public void destroy() {
    context.cancel();
    events.close();
    console.close();
  }
}
