package com.example.directory.config;

/** Headers set by the command-dispatch caller on every operator request. */
public final class ActorHeaders {

  public static final String ACTOR_USER_ID = "X-Actor-User-Id";

  private ActorHeaders() {}
}
