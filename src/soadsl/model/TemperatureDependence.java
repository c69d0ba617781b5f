package soadsl.model;

/**
 * Linear temperature dependence of a limit: {@code referenceValue + tempCoefficient * (T - referenceTemp)}.
 * A null {@code referenceTemp} means the global {@code tref_soa} applies.
 */
public record TemperatureDependence(LimitValue referenceTemp, LimitValue referenceValue, double tempCoefficient) {}
