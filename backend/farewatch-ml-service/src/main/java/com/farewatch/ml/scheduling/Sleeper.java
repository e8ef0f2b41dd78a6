package com.farewatch.ml.scheduling;

import java.time.Duration;

@FunctionalInterface
interface Sleeper {

  Sleeper THREAD = d -> Thread.sleep(d.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
