package bsts.inference;

import bsts.global.ModelComponent;

/** The engine's receipt for a declared prior. */
public record PriorHandle(ModelComponent component, String parameterName, int width) {}
