package io.webber.infrastructure.time;

import io.webber.application.port.ClockPort;

/**
 * {@link ClockPort} reading the system wall clock.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
