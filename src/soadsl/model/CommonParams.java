package soadsl.model;

import java.util.Optional;

/**
 * Timing parameters every checker model takes. The converter fills them with symbolic references to the base section
 * ({@code global_tmin}, ...), resolved by the simulator. {@code tmaxfrac} is an alias like {@code tmaxfrac0}, or null.
 */
public record CommonParams(LimitValue tmin, LimitValue tdelay, LimitValue vballmsg, LimitValue stop, String tmaxfrac) {
  public static CommonParams symbolic(String tmaxfrac) {
    return new CommonParams(LimitValue.expression("global_tmin"), LimitValue.expression("global_tdelay"),
                            LimitValue.expression("global_vballmsg"), LimitValue.expression("global_stop"), tmaxfrac);
  }

  public Optional<String> getTmaxfrac() { return Optional.ofNullable(tmaxfrac); }
}
