package soadsl.model;

/** Gate control limits of a state-dependent MOS rule. */
public record GateControl(LimitValue vhighGc, LimitValue vlowGc) {}
