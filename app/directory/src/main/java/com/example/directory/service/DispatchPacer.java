package com.example.directory.service;

import java.time.Duration;

/** Waits between two dispatch batches. */
public interface DispatchPacer {

  void pause(Duration delay);
}
