package com.flamingo.ai.studybuddy.engine.resource;

/** Decides whether the resources behind a model path are present. */
@FunctionalInterface
public interface ModelResourceCheck {

  boolean exists(String modelPath);
}
